package net.lightapi.querylogs.tag;

import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Produces the value of one tag. The kind of handler is chosen when the tag is declared:
 * a static value, a supplier that ignores the context, or a function of the context.
 * A null result means the tag is omitted from the comment.
 */
public interface TagHandler {

    /**
     * Computes the tag value.
     *
     * @param context read-only view of the current execution context
     * @return the value, or null to omit the tag
     */
    Object resolve(Map<String, Object> context);

    static TagHandler staticValue(Object value) {
        return new StaticTagHandler(value);
    }

    static TagHandler supplier(Supplier<?> supplier) {
        return new SupplierTagHandler(supplier);
    }

    static TagHandler fromContext(Function<Map<String, Object>, ?> function) {
        return new ContextTagHandler(function);
    }
}
