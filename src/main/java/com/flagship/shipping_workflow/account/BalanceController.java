package com.flagship.shipping_workflow.account;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;

@RestController
@RequiredArgsConstructor
public class BalanceController {

    private final BalanceService balanceService;

    @GetMapping("/api/users/{userKey}/balance")
    public BalanceResponse balance(@PathVariable String userKey) {
        return new BalanceResponse(userKey, balanceService.getBalance(userKey));
    }

    @Value
    public static class BalanceResponse {
        @JsonProperty("user_key")
        String userKey;
        @JsonProperty("balance")
        BigDecimal balance;
    }
}
