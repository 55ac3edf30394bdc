package io.rasasa.evaluation.runner;

/**
 * Child process that outlives any test unless it is killed.
 */
public final class SleepingMain {

    private SleepingMain() {}

    public static void main(String[] args) throws InterruptedException {
        Thread.sleep(120_000);
    }
}
