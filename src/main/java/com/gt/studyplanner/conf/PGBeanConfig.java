package com.gt.studyplanner.conf;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.studyplanner.course.CourseDao;
import com.gt.studyplanner.course.impl.CourseDaoPG;
import com.gt.studyplanner.history.PerformanceHistoryDao;
import com.gt.studyplanner.history.impl.PerformanceHistoryDaoPG;
import com.gt.studyplanner.plan.StudyPlanDao;
import com.gt.studyplanner.plan.impl.StudyPlanDaoPG;
import com.gt.studyplanner.repetition.ReviewStateDao;
import com.gt.studyplanner.repetition.impl.ReviewStateDaoPG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;

@Configuration
public class PGBeanConfig {

    @Bean
    public DataSource getDataSource(@Value("${planner.datasource.postgres.url}") String url,
                                    @Value("${planner.datasource.postgres.username}") String username,
                                    @Value("${planner.datasource.postgres.password}") String password) {
        return new DriverManagerDataSource(url, username, password);
    }

    @Bean
    public NamedParameterJdbcTemplate getNamedParameterJdbcTemplate(DataSource dataSource) {
        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    public PerformanceHistoryDao getPerformanceHistoryDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new PerformanceHistoryDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public CourseDao getCourseDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new CourseDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public ReviewStateDao getReviewStateDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new ReviewStateDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public StudyPlanDao getStudyPlanDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate, ObjectMapper objectMapper) {
        return new StudyPlanDaoPG(namedParameterJdbcTemplate, objectMapper);
    }
}
