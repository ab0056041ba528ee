package work.lcod.markup.sandbox;

/**
 * Worker stand-in that never answers.
 */
public final class HangingWorker {
    private HangingWorker() {}

    public static void main(String[] args) throws InterruptedException {
        while (true) {
            Thread.sleep(60_000L);
        }
    }
}
