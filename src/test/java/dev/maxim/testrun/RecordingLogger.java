package dev.maxim.testrun;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Keeps every message a test run logs. */
class RecordingLogger implements TestRunLogger {
    final List<String> infos = new CopyOnWriteArrayList<>();
    final List<String> errors = new CopyOnWriteArrayList<>();
    final List<ProcessedEntry> processed = new CopyOnWriteArrayList<>();

    @Override
    public void info(String message) {
        infos.add(message);
    }

    @Override
    public void error(String message) {
        errors.add(message);
    }

    @Override
    public void processed(String message, ProcessedEntry entry) {
        processed.add(entry);
    }
}
