package com.snubalink.service.core.snql;

import com.snubalink.query.Aggregation;
import com.snubalink.query.ColumnResolvers;
import com.snubalink.query.Dataset;
import com.snubalink.query.SnubaQueryParams;
import com.snubalink.query.condition.Condition;
import com.snubalink.query.condition.Expression;
import com.snubalink.query.condition.FunctionCall;
import com.snubalink.query.condition.Operator;
import com.snubalink.service.core.params.OrganizationResolver;
import com.snubalink.service.core.params.OrganizationScope;
import com.snubalink.service.core.params.PreparedQuery;
import java.util.ArrayList;
import java.util.List;

/** Rewrites a prepared legacy query as an equivalent structured query. */
public final class LegacySnqlConverter {

    private LegacySnqlConverter() {}

    public static SnqlQuery convert(PreparedQuery prepared) {
        SnubaQueryParams params = prepared.params();
        Dataset dataset = prepared.dataset();

        List<Expression> select = new ArrayList<>(params.getSelectedColumns());
        for (Aggregation aggregation : params.getAggregations()) {
            List<Expression> args = new ArrayList<>();
            aggregation.columns().forEach(column -> args.add(Expression.column(column)));
            select.add(new FunctionCall(aggregation.function(), args, aggregation.alias()));
        }

        List<Expression> groupby = new ArrayList<>();
        params.getGroupby().forEach(column -> groupby.add(Expression.column(column)));

        String timestamp = ColumnResolvers.forDataset(dataset).resolve("timestamp");
        List<Condition> where = new ArrayList<>();
        where.add(Condition.of(timestamp, Operator.GTE, prepared.start()));
        where.add(Condition.of(timestamp, Operator.LT, prepared.end()));
        OrganizationScope scope = prepared.scope();
        if (!scope.projectIds().isEmpty()) {
            where.add(Condition.in(OrganizationResolver.PROJECT_ID, scope.projectIds()));
        } else {
            where.add(Condition.of(OrganizationResolver.ORG_ID, Operator.EQ, scope.organizationId()));
        }
        where.addAll(prepared.conditions());

        List<SnqlQuery.OrderBy> orderby = new ArrayList<>();
        params.getOrderby().forEach(field -> orderby.add(SnqlQuery.OrderBy.parse(field)));

        return SnqlQuery.builder(dataset.value())
                .entity(dataset.entity())
                .sample(params.getSample())
                .select(select)
                .groupby(groupby)
                .arrayJoin(params.getArrayjoin())
                .where(where)
                .having(params.getHaving())
                .orderby(orderby)
                .limit(params.getLimit())
                .offset(params.getOffset())
                .granularity(params.getRollup())
                .totals(params.isTotals())
                .turbo(params.getTurbo())
                .consistent(params.getConsistent())
                .debug(params.getDebug())
                .build();
    }
}
