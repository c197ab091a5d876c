package io.quarkus.qe.perf.regression.detector.cli;

import io.quarkus.qe.perf.regression.detector.logger.Logger;
import jakarta.inject.Singleton;

import java.io.PrintWriter;

@Singleton
final class ConsoleLogger implements Logger {

    private PrintWriter stdOutWriter = new PrintWriter(System.out, true);
    private PrintWriter stdErrWriter = new PrintWriter(System.err, true);
    private boolean debug = false;

    void setWriters(PrintWriter stdOutWriter, PrintWriter stdErrWriter, boolean debug) {
        this.stdOutWriter = stdOutWriter;
        this.stdErrWriter = stdErrWriter;
        this.debug = debug;
    }

    @Override
    public synchronized void info(String logMessage) {
        stdOutWriter.println(logMessage);
        stdOutWriter.flush();
    }

    @Override
    public synchronized void error(String logMessage) {
        stdErrWriter.println(logMessage);
        stdErrWriter.flush();
    }

    @Override
    public synchronized void error(String logMessage, Throwable throwable) {
        error(logMessage + ": " + throwable.getMessage());
        if (debug) {
            throwable.printStackTrace(stdErrWriter);
            stdErrWriter.flush();
        }
    }

    @Override
    public void debug(String logMessage) {
        if (debug) {
            info("DEBUG: " + logMessage);
        }
    }
}
