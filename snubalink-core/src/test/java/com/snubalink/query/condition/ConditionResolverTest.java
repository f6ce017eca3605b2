package com.snubalink.query.condition;

import static org.assertj.core.api.Assertions.assertThat;

import com.snubalink.query.ColumnResolver;
import com.snubalink.query.ColumnResolvers;
import com.snubalink.query.Dataset;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ConditionResolverTest {

    private final ColumnResolver events = ColumnResolvers.forDataset(Dataset.EVENTS);

    @Test
    void resolvesOnlyLeftHandSideOfLeafConditions() {
        Condition resolved = ConditionResolver.resolve(PositionalConditions.parse(List.of("release", "=", "release")), events);

        assertThat(PositionalConditions.render(resolved)).isEqualTo(List.of("tags[sentry:release]", "=", "release"));
    }

    @Test
    void membershipValuesAreNeverResolved() {
        Condition resolved = ConditionResolver.resolve(Condition.in("environment", List.of("release", "foo")), events);

        assertThat(PositionalConditions.render(resolved))
                .isEqualTo(List.of("environment", "IN", List.of("release", "foo")));
    }

    @Test
    void comparisonFunctionsResolveFirstArgumentOnly() {
        Condition parsed = PositionalConditions.parse(List.of("equals", List.of("user.email", "foo@example.com")));

        Object rendered = PositionalConditions.render(ConditionResolver.resolve(parsed, events));

        assertThat(rendered).isEqualTo(List.of("equals", List.of("email", "'foo@example.com'")));
    }

    @Test
    void otherFunctionsResolveColumnArgumentsAndRecurse() {
        Condition parsed = PositionalConditions.parse(List.of(
                List.of("ifNull", List.of(List.of("coalesce", List.of("user.email", "user.username")), "''")),
                "=",
                "x"));

        Object rendered = PositionalConditions.render(ConditionResolver.resolve(parsed, events));

        assertThat(rendered)
                .isEqualTo(List.of(
                        List.of("ifNull", List.of(List.of("coalesce", List.of("email", "username")), "''")), "=", "x"));
    }

    @Test
    void logicalFunctionsResolveEveryNestedCall() {
        Condition parsed = PositionalConditions.parse(List.of(
                "or",
                List.of(List.of("equals", List.of("release", "'1'")), List.of("isNull", List.of("environment")))));

        Object rendered = PositionalConditions.render(ConditionResolver.resolve(parsed, events));

        assertThat(rendered)
                .isEqualTo(List.of(
                        "or",
                        List.of(
                                List.of("equals", List.of("tags[sentry:release]", "'1'")),
                                List.of("isNull", List.of("environment")))));
    }

    @Test
    void orGroupsResolveEachAlternative() {
        Condition parsed = PositionalConditions.parse(
                List.of(List.of("release", "=", "a"), Arrays.asList("foo", "IS NULL", null)));

        Object rendered = PositionalConditions.render(ConditionResolver.resolve(parsed, events));

        assertThat(rendered)
                .isEqualTo(List.of(
                        List.of("tags[sentry:release]", "=", "a"), Arrays.asList("tags[foo]", "IS NULL", null)));
    }

    @Test
    void complexColumnsSkipDerivedAliases() {
        FunctionCall call = new FunctionCall(
                "divide", List.of(Expression.column("count_unique_user"), Expression.column("user.id")), "ratio");

        FunctionCall resolved = ConditionResolver.resolveComplexColumn(call, events, Set.of("count_unique_user"));

        assertThat(resolved.args())
                .containsExactly(Expression.column("count_unique_user"), Expression.column("user_id"));
        assertThat(resolved.alias()).isEqualTo("ratio");
        assertThat(call.args()).containsExactly(Expression.column("count_unique_user"), Expression.column("user.id"));
    }
}
