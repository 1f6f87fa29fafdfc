package net.lightapi.querylogs.tag;

import java.util.Map;

public class StaticTagHandler implements TagHandler {
    private final Object value;

    public StaticTagHandler(Object value) {
        this.value = value;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public Object resolve(Map<String, Object> context) {
        return value;
    }

    @Override
    public String toString() {
        return "StaticTagHandler{" + value + "}";
    }
}
