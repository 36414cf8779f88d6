package stylekit.css.condition;

import java.util.List;
import java.util.StringJoiner;

/**
 * Two or more conditions joined with {@code or}. Conditions joined with the same connector
 * are kept in a single flat list.
 */
public record OrCondition(List<CssCondition> conditions) implements CssCondition {

    public OrCondition {
        conditions = List.copyOf(conditions);

        if (conditions.size() < 2) {
            throw new IllegalArgumentException("OrCondition requires at least two conditions");
        }
    }

    @Override
    public boolean check() {
        return conditions.stream().anyMatch(CssCondition::check);
    }

    @Override
    public String toCss() {
        var joiner = new StringJoiner(" or ");

        for (CssCondition condition : conditions) {
            joiner.add(condition.toCss());
        }

        return joiner.toString();
    }
}
