package dk.cloudcreate.essentials.eventsourcing.postgresql;

import dk.cloudcreate.essentials.eventsourcing.aggregates.StreamVersion;
import dk.cloudcreate.essentials.eventsourcing.store.persistence.AggregateSnapshot;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.*;
import java.time.OffsetDateTime;

class AggregateSnapshotRowMapper implements RowMapper<AggregateSnapshot> {
    @Override
    public AggregateSnapshot map(ResultSet rs, StatementContext ctx) throws SQLException {
        return new AggregateSnapshot(rs.getString("state_payload"),
                                     StreamVersion.of(rs.getLong("stream_version")),
                                     rs.getInt("logical_version"),
                                     rs.getObject("snapshot_timestamp", OffsetDateTime.class));
    }
}
