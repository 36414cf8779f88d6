package stylekit.css.condition;

import java.util.List;
import java.util.StringJoiner;

/**
 * Two or more conditions joined with {@code and}. Conditions joined with the same connector
 * are kept in a single flat list.
 */
public record AndCondition(List<CssCondition> conditions) implements CssCondition {

    public AndCondition {
        conditions = List.copyOf(conditions);

        if (conditions.size() < 2) {
            throw new IllegalArgumentException("AndCondition requires at least two conditions");
        }
    }

    @Override
    public boolean check() {
        return conditions.stream().allMatch(CssCondition::check);
    }

    @Override
    public String toCss() {
        var joiner = new StringJoiner(" and ");

        for (CssCondition condition : conditions) {
            joiner.add(condition.toCss());
        }

        return joiner.toString();
    }
}
