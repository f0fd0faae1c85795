package com.gt.studyplanner.model;

import java.time.Instant;

// score is a percentage, 0-100
public record QuizAttempt(String quizId,
                          double score,
                          Instant startedAt,
                          Difficulty quizDifficulty) { }
