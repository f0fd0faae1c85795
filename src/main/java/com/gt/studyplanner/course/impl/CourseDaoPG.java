package com.gt.studyplanner.course.impl;

import com.gt.studyplanner.course.CourseDao;
import com.gt.studyplanner.model.Course;
import com.gt.studyplanner.model.CourseTopic;
import com.gt.studyplanner.model.Difficulty;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class CourseDaoPG implements CourseDao {

    private static final String GET_COURSE_NAME_SQL =
            "SELECT name FROM course WHERE id = :courseId";

    private static final String GET_COURSE_TOPICS_SQL =
            "SELECT id, title, difficulty " +
            "FROM course_topic " +
            "WHERE course_id = :courseId " +
            "ORDER BY seq_num ASC";

    private static final String LEARNER_EXISTS_SQL =
            "SELECT COUNT(*) FROM learner WHERE id = :learnerId";

    private final NamedParameterJdbcTemplate template;

    public CourseDaoPG(NamedParameterJdbcTemplate template) {
        this.template = template;
    }

    @Override
    public Optional<Course> loadCourse(String courseId) {
        List<String> names = template.queryForList(GET_COURSE_NAME_SQL, Map.of("courseId", courseId), String.class);
        if (names.isEmpty()) {
            return Optional.empty();
        }

        List<CourseTopic> topics = template.query(GET_COURSE_TOPICS_SQL, Map.of("courseId", courseId), CourseDaoPG::mapCourseTopic);

        return Optional.of(new Course(courseId, names.get(0), topics));
    }

    @Override
    public boolean learnerExists(String learnerId) {
        Integer count = template.queryForObject(LEARNER_EXISTS_SQL, Map.of("learnerId", learnerId), Integer.class);
        return count != null && count > 0;
    }

    private static CourseTopic mapCourseTopic(ResultSet rs, int rowNum) throws SQLException {
        String difficulty = rs.getString("difficulty");
        return new CourseTopic(
                rs.getString("id"),
                rs.getString("title"),
                difficulty == null ? Difficulty.Medium : Difficulty.fromWireName(difficulty));
    }
}
