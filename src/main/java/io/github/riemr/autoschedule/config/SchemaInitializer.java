package io.github.riemr.autoschedule.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "autoschedule.schema.initialize", havingValue = "true", matchIfMissing = true)
public class SchemaInitializer {
    private final JdbcTemplate jdbc;

    @PostConstruct
    public void ensureTables() {
        try {
            // Catalog (read-only for the scheduler)
            jdbc.execute("CREATE TABLE IF NOT EXISTS group_type (" +
                    "id BIGSERIAL PRIMARY KEY, " +
                    "guid UUID NOT NULL UNIQUE, " +
                    "name TEXT NOT NULL, " +
                    "is_scheduling_enabled BOOLEAN NOT NULL DEFAULT FALSE" +
                    ")");
            jdbc.execute("CREATE TABLE IF NOT EXISTS group_master (" +
                    "id BIGSERIAL PRIMARY KEY, " +
                    "guid UUID NOT NULL UNIQUE, " +
                    "group_type_id BIGINT NOT NULL REFERENCES group_type(id), " +
                    "parent_group_id BIGINT REFERENCES group_master(id), " +
                    "name TEXT NOT NULL, " +
                    "is_active BOOLEAN NOT NULL DEFAULT TRUE, " +
                    "is_archived BOOLEAN NOT NULL DEFAULT FALSE, " +
                    "disable_scheduling BOOLEAN NOT NULL DEFAULT FALSE" +
                    ")");
            jdbc.execute("CREATE INDEX IF NOT EXISTS idx_group_master_type ON group_master (group_type_id)");
            jdbc.execute("CREATE TABLE IF NOT EXISTS location (" +
                    "id BIGSERIAL PRIMARY KEY, " +
                    "name TEXT NOT NULL" +
                    ")");
            jdbc.execute("CREATE TABLE IF NOT EXISTS schedule (" +
                    "id BIGSERIAL PRIMARY KEY, " +
                    "name TEXT, " +
                    "cron_expression VARCHAR(128), " +
                    "weekly_day_of_week SMALLINT CHECK (weekly_day_of_week BETWEEN 1 AND 7), " +
                    "weekly_time_of_day TIME, " +
                    "effective_start_date DATE, " +
                    "effective_end_date DATE, " +
                    "is_active BOOLEAN NOT NULL DEFAULT TRUE" +
                    ")");
            jdbc.execute("CREATE TABLE IF NOT EXISTS group_location (" +
                    "id BIGSERIAL PRIMARY KEY, " +
                    "group_id BIGINT NOT NULL REFERENCES group_master(id), " +
                    "location_id BIGINT NOT NULL REFERENCES location(id), " +
                    "display_order INTEGER NOT NULL DEFAULT 0" +
                    ")");
            jdbc.execute("CREATE TABLE IF NOT EXISTS group_location_schedule (" +
                    "group_location_id BIGINT NOT NULL REFERENCES group_location(id) ON DELETE CASCADE, " +
                    "schedule_id BIGINT NOT NULL REFERENCES schedule(id), " +
                    "PRIMARY KEY (group_location_id, schedule_id)" +
                    ")");

            // Attributes
            jdbc.execute("CREATE TABLE IF NOT EXISTS attribute (" +
                    "id BIGSERIAL PRIMARY KEY, " +
                    "entity_type VARCHAR(32) NOT NULL, " +
                    "attribute_key VARCHAR(128) NOT NULL, " +
                    "group_type_id BIGINT REFERENCES group_type(id), " +
                    "default_value TEXT" +
                    ")");
            jdbc.execute("CREATE TABLE IF NOT EXISTS attribute_value (" +
                    "attribute_id BIGINT NOT NULL REFERENCES attribute(id) ON DELETE CASCADE, " +
                    "entity_id BIGINT NOT NULL, " +
                    "value TEXT, " +
                    "PRIMARY KEY (attribute_id, entity_id)" +
                    ")");

            // People
            jdbc.execute("CREATE TABLE IF NOT EXISTS person (" +
                    "id BIGSERIAL PRIMARY KEY, " +
                    "first_name TEXT, " +
                    "last_name TEXT" +
                    ")");
            jdbc.execute("CREATE TABLE IF NOT EXISTS person_alias (" +
                    "id BIGSERIAL PRIMARY KEY, " +
                    "guid UUID NOT NULL UNIQUE, " +
                    "person_id BIGINT NOT NULL REFERENCES person(id), " +
                    "is_primary BOOLEAN NOT NULL DEFAULT FALSE" +
                    ")");
            jdbc.execute("CREATE TABLE IF NOT EXISTS group_member (" +
                    "id BIGSERIAL PRIMARY KEY, " +
                    "group_id BIGINT NOT NULL REFERENCES group_master(id), " +
                    "person_id BIGINT NOT NULL REFERENCES person(id), " +
                    "is_active BOOLEAN NOT NULL DEFAULT TRUE, " +
                    "preferred_schedule_id BIGINT REFERENCES schedule(id), " +
                    "preferred_location_id BIGINT REFERENCES location(id)" +
                    ")");

            // Occurrences and attendance (written by the scheduler)
            jdbc.execute("CREATE TABLE IF NOT EXISTS attendance_occurrence (" +
                    "id BIGSERIAL PRIMARY KEY, " +
                    "occurrence_date DATE NOT NULL, " +
                    "group_id BIGINT NOT NULL REFERENCES group_master(id), " +
                    "location_id BIGINT NOT NULL REFERENCES location(id), " +
                    "schedule_id BIGINT NOT NULL REFERENCES schedule(id)" +
                    ")");
            // get-or-add depends on this index
            jdbc.execute("CREATE UNIQUE INDEX IF NOT EXISTS uq_attendance_occurrence_key " +
                    "ON attendance_occurrence (occurrence_date, group_id, location_id, schedule_id)");
            jdbc.execute("CREATE TABLE IF NOT EXISTS attendance (" +
                    "id BIGSERIAL PRIMARY KEY, " +
                    "occurrence_id BIGINT NOT NULL REFERENCES attendance_occurrence(id), " +
                    "person_alias_id BIGINT NOT NULL REFERENCES person_alias(id), " +
                    "rsvp VARCHAR(10) NOT NULL DEFAULT 'UNKNOWN' CHECK (rsvp IN ('YES','NO','MAYBE','UNKNOWN')), " +
                    "requested_to_attend BOOLEAN NOT NULL DEFAULT FALSE, " +
                    "scheduled_to_attend BOOLEAN NOT NULL DEFAULT FALSE, " +
                    "did_attend BOOLEAN, " +
                    "scheduled_by_person_alias_id BIGINT REFERENCES person_alias(id), " +
                    "rsvp_date_time TIMESTAMP, " +
                    "created_at TIMESTAMP NOT NULL DEFAULT now()" +
                    ")");
            jdbc.execute("CREATE UNIQUE INDEX IF NOT EXISTS uq_attendance_occurrence_person " +
                    "ON attendance (occurrence_id, person_alias_id)");
            jdbc.execute("CREATE INDEX IF NOT EXISTS idx_attendance_occurrence ON attendance (occurrence_id)");

            log.info("Schema checked/initialized: catalog, attendance_occurrence and attendance tables ensured.");
        } catch (Exception e) {
            log.warn("Schema initialization failed: {}", e.getMessage());
        }
    }
}
