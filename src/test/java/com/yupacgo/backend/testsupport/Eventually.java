package com.yupacgo.backend.testsupport;

import java.time.Duration;

/** Polls an assertion until it passes or the timeout runs out (for work done on the audit executor). */
public final class Eventually {

    @FunctionalInterface
    public interface Check {
        void run() throws Exception;
    }

    private Eventually() {}

    public static void await(Duration timeout, Check check) throws Exception {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            try {
                check.run();
                return;
            } catch (AssertionError e) {
                if (System.nanoTime() > deadline) throw e;
                Thread.sleep(25);
            }
        }
    }

    public static void await(Check check) throws Exception {
        await(Duration.ofSeconds(5), check);
    }
}
