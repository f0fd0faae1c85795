package com.gt.studyplanner.plan.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.studyplanner.exception.DaoException;
import com.gt.studyplanner.exception.MappingException;
import com.gt.studyplanner.model.PlanStatus;
import com.gt.studyplanner.model.StudyPlan;
import com.gt.studyplanner.plan.StudyPlanDao;
import org.postgresql.util.PGobject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Date;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Map;
import java.util.Optional;

// Plans are stored as one JSON document per row, with the columns needed for lookups and the version lifted out
public class StudyPlanDaoPG implements StudyPlanDao {

    private static final Logger log = LoggerFactory.getLogger(StudyPlanDaoPG.class);

    private static final String GET_PLAN_SQL =
            "SELECT document FROM study_plan WHERE id = :planId";

    private static final String GET_ACTIVE_PLAN_SQL =
            "SELECT document FROM study_plan " +
            "WHERE learner_id = :learnerId AND course_id = :courseId AND status = :activeStatus";

    private static final String GET_ACTIVE_PLAN_IDS_SQL =
            "SELECT id FROM study_plan WHERE status = :activeStatus ORDER BY created_at ASC";

    private static final String INSERT_PLAN_SQL =
            "INSERT INTO study_plan (id, learner_id, course_id, plan_type, status, start_date, end_date, document, version, created_at, updated_at) " +
            "VALUES (:id, :learnerId, :courseId, :planType, :status, :startDate, :endDate, :document, :version, :createdAt, :updatedAt)";

    private static final String UPDATE_PLAN_SQL =
            "UPDATE study_plan " +
            "SET status = :status, end_date = :endDate, document = :document, version = :expectedVersion + 1, updated_at = :updatedAt " +
            "WHERE id = :id AND version = :expectedVersion";

    private final NamedParameterJdbcTemplate template;
    private final ObjectMapper objectMapper;

    public StudyPlanDaoPG(NamedParameterJdbcTemplate template, ObjectMapper objectMapper) {
        this.template = template;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<StudyPlan> loadPlan(String planId) {
        return template.query(GET_PLAN_SQL, Map.of("planId", planId), (rs, rowNum) -> fromDocument(rs.getString("document")))
                .stream()
                .findFirst();
    }

    @Override
    public Optional<StudyPlan> loadActivePlan(String learnerId, String courseId) {
        return template.query(GET_ACTIVE_PLAN_SQL,
                        Map.of("learnerId", learnerId, "courseId", courseId, "activeStatus", PlanStatus.Active.getWireName()),
                        (rs, rowNum) -> fromDocument(rs.getString("document")))
                .stream()
                .findFirst();
    }

    @Override
    public List<String> loadActivePlanIds() {
        return template.query(GET_ACTIVE_PLAN_IDS_SQL,
                Map.of("activeStatus", PlanStatus.Active.getWireName()),
                (rs, rowNum) -> rs.getString("id"));
    }

    @Override
    public void createPlan(StudyPlan plan) {
        MapSqlParameterSource params = planParams(plan);
        params.addValue("learnerId", plan.learnerId());
        params.addValue("courseId", plan.courseId());
        params.addValue("planType", plan.planType().getWireName());
        params.addValue("startDate", Date.valueOf(plan.startDate()));
        params.addValue("version", plan.version());
        params.addValue("createdAt", Timestamp.from(plan.createdAt()));

        try {
            template.update(INSERT_PLAN_SQL, params);
        } catch (DuplicateKeyException ex) {
            throw new DaoException("Learner " + plan.learnerId() + " already has an active plan for course " + plan.courseId(), ex);
        }
    }

    @Override
    public boolean savePlan(StudyPlan plan, long expectedVersion) {
        MapSqlParameterSource params = planParams(plan);
        params.addValue("expectedVersion", expectedVersion);

        int rows = template.update(UPDATE_PLAN_SQL, params);
        if (rows == 0) {
            log.debug("Conditional write of plan {} at version {} matched no row", plan.id(), expectedVersion);
        }

        return rows == 1;
    }

    private MapSqlParameterSource planParams(StudyPlan plan) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("id", plan.id());
        params.addValue("status", plan.status().getWireName());
        params.addValue("endDate", Date.valueOf(plan.endDate()));
        params.addValue("document", toDocument(plan));
        params.addValue("updatedAt", Timestamp.from(plan.updatedAt()));

        return params;
    }

    private PGobject toDocument(StudyPlan plan) {
        try {
            PGobject document = new PGobject();
            document.setType("jsonb");
            document.setValue(objectMapper.writeValueAsString(plan));
            return document;
        } catch (JsonProcessingException | SQLException ex) {
            throw new MappingException("Unable to serialize study plan " + plan.id(), ex);
        }
    }

    private StudyPlan fromDocument(String document) {
        try {
            return objectMapper.readValue(document, StudyPlan.class);
        } catch (JsonProcessingException ex) {
            throw new MappingException("Unable to read stored study plan", ex);
        }
    }
}
