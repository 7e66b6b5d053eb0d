package dev.maxim.testrun;

import java.util.Map;

/** Produces the output of one row in this process. */
@FunctionalInterface
public interface OutputFunction {
    YieldedOutput produce(Map<String, Object> data) throws Exception;
}
