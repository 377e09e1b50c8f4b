package com.phillippitts.speakstream.testutil;

import java.util.concurrent.Executor;

/**
 * Runs tasks immediately on the calling thread.
 */
public class SyncExecutor implements Executor {
    @Override
    public void execute(Runnable command) {
        command.run();
    }
}
