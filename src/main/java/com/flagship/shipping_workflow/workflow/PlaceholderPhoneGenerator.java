package com.flagship.shipping_workflow.workflow;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Produces a syntactically valid US phone number for users who skip the
 * phone step; carriers reject labels without one.
 *
 * Area code and exchange both start with 2-9 and avoid the N11 service codes.
 */
public class PlaceholderPhoneGenerator implements Supplier<String> {

    @Override
    public String get() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        return "+1" + threeDigitBlock(random) + threeDigitBlock(random)
                + String.format("%04d", random.nextInt(10_000));
    }

    private static String threeDigitBlock(ThreadLocalRandom random) {
        int first = 2 + random.nextInt(8);
        int second = random.nextInt(10);
        int third = random.nextInt(10);
        if (second == 1 && third == 1) {
            third = 2;
        }
        return "" + first + second + third;
    }
}
