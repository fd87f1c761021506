package com.flagship.shipping_workflow.quote;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.shipping_workflow.config.WorkflowProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisQuoteCacheTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisQuoteCache cache;

    @BeforeEach
    void setUp() {
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        cache = new RedisQuoteCache(redisTemplate, new ObjectMapper(), new WorkflowProperties());
    }

    @Test
    @DisplayName("Quotes are stored as JSON under the prefixed key with the given TTL")
    void set_writesJsonWithTtl() {
        cache.set("abc", List.of(new Quote("q-1", "USPS", "Priority Mail", new BigDecimal("8.40"), 3)),
                Duration.ofMinutes(60));

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOperations).set(eq("quotes:abc"), json.capture(), eq(Duration.ofMinutes(60)));
        assertTrue(json.getValue().contains("\"quote_id\":\"q-1\""));
        assertTrue(json.getValue().contains("\"estimated_days\":3"));
    }

    @Test
    @DisplayName("Cached JSON is read back into quotes")
    void get_readsJson() {
        when(valueOperations.get("quotes:abc")).thenReturn(
                "[{\"quote_id\":\"q-1\",\"carrier\":\"USPS\",\"service\":\"Priority Mail\",\"amount\":8.40,\"estimated_days\":3}]");

        List<Quote> quotes = cache.get("abc").orElseThrow();

        assertEquals(1, quotes.size());
        assertEquals("q-1", quotes.get(0).getQuoteId());
        assertEquals(0, new BigDecimal("8.40").compareTo(quotes.get(0).getAmount()));
    }

    @Test
    @DisplayName("Redis outages degrade to cache misses")
    void get_redisDownIsMiss() {
        when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("refused"));

        assertTrue(cache.get("abc").isEmpty());
    }

    @Test
    @DisplayName("Write failures are logged, not thrown")
    void set_redisDownIsIgnored() {
        doThrow(new RedisConnectionFailureException("refused"))
                .when(valueOperations).set(anyString(), anyString(), any(Duration.class));

        assertDoesNotThrow(() -> cache.set("abc", List.of(), Duration.ofMinutes(1)));
    }

    @Test
    @DisplayName("Unreadable entries are dropped and reported as a miss")
    void get_corruptEntryIsDeleted() {
        when(valueOperations.get("quotes:abc")).thenReturn("{broken");

        assertTrue(cache.get("abc").isEmpty());
        verify(redisTemplate).delete("quotes:abc");
    }
}
