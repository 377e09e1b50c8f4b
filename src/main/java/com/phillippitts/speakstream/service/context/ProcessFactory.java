package com.phillippitts.speakstream.service.context;

import java.io.IOException;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so subprocess-based inspectors can be tested hermetically.
 */
@FunctionalInterface
interface ProcessFactory {

    /**
     * Starts a process.
     *
     * @param command executable followed by its arguments
     * @return the started process
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command) throws IOException;

    static ProcessFactory system() {
        return command -> new ProcessBuilder(command).redirectErrorStream(false).start();
    }
}
