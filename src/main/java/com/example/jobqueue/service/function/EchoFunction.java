package com.example.jobqueue.service.function;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in function returning its arguments, handy for checking a deployment end to end.
 */
@Component
public class EchoFunction implements JobFunction {

    public static final String NAME = "echo";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Object run(List<Object> args, Map<String, Object> kwargs) {
        var result = new LinkedHashMap<String, Object>();
        result.put("args", args);
        result.put("kwargs", kwargs);
        return result;
    }
}
