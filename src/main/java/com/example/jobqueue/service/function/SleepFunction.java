package com.example.jobqueue.service.function;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Built-in function that sleeps for {@code seconds} (first argument or keyword) and
 * returns the slept milliseconds.
 */
@Component
public class SleepFunction implements JobFunction {

    public static final String NAME = "sleep";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Object run(List<Object> args, Map<String, Object> kwargs) throws InterruptedException {
        Object seconds = kwargs != null ? kwargs.get("seconds") : null;
        if (seconds == null && args != null && !args.isEmpty()) {
            seconds = args.get(0);
        }
        if (!(seconds instanceof Number)) {
            throw new IllegalArgumentException("sleep expects a numeric 'seconds' argument");
        }
        var millis = (long) (((Number) seconds).doubleValue() * 1000);
        Thread.sleep(millis);
        return millis;
    }
}
