package net.lightapi.querylogs.tag;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

public class ContextTagHandler implements TagHandler {
    private final Function<Map<String, Object>, ?> function;

    public ContextTagHandler(Function<Map<String, Object>, ?> function) {
        this.function = Objects.requireNonNull(function, "function");
    }

    @Override
    public Object resolve(Map<String, Object> context) {
        return function.apply(context);
    }
}
