package com.gt.studyplanner.analysis;

import com.gt.studyplanner.metrics.Statistics;
import com.gt.studyplanner.model.Trend;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

@Component
public class TrendAnalyzer {

    public static final int MIN_TREND_POINTS = 3;

    private final double threshold;

    @Autowired
    public TrendAnalyzer(@Value("${planner.analysis.trendThreshold:0.3}") double threshold) {
        this.threshold = threshold;
    }

    /**
     * Classifies an ordered series by its correlation with time. Fewer than three points is InsufficientData;
     * a series with no variance is Stable.
     */
    public Trend trend(List<Double> values) {
        if (values == null || values.size() < MIN_TREND_POINTS) {
            return Trend.InsufficientData;
        }

        double r = Statistics.correlationWithIndex(values);
        if (r > threshold) {
            return Trend.Improving;
        } else if (r < -threshold) {
            return Trend.Declining;
        }
        return Trend.Stable;
    }

    // Majority of the clear trends wins, a tie is stable. With nothing but insufficient data the result is too.
    public Trend overallTrend(Collection<Trend> trends) {
        int improving = 0;
        int declining = 0;
        int known = 0;
        for (Trend trend : trends) {
            if (trend == Trend.Improving) {
                improving++;
            } else if (trend == Trend.Declining) {
                declining++;
            }
            if (trend != Trend.InsufficientData) {
                known++;
            }
        }

        if (known == 0) {
            return Trend.InsufficientData;
        } else if (improving > declining) {
            return Trend.Improving;
        } else if (declining > improving) {
            return Trend.Declining;
        }
        return Trend.Stable;
    }
}
