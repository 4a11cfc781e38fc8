package dk.cloudcreate.essentials.eventsourcing.postgresql;

import dk.cloudcreate.essentials.eventsourcing.aggregates.EventName;
import dk.cloudcreate.essentials.eventsourcing.store.persistence.*;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.*;
import java.time.OffsetDateTime;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

class PersistedEventRowMapper implements RowMapper<PersistedEvent> {
    private final AggregateType aggregateType;

    PersistedEventRowMapper(AggregateType aggregateType) {
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
    }

    @Override
    public PersistedEvent map(ResultSet rs, StatementContext ctx) throws SQLException {
        return PersistedEvent.from(aggregateType,
                                   rs.getString("aggregate_id"),
                                   EventOrder.of(rs.getLong("event_order")),
                                   EventName.of(rs.getString("event_name")),
                                   rs.getString("event_payload"),
                                   rs.getObject("event_timestamp", OffsetDateTime.class));
    }
}
