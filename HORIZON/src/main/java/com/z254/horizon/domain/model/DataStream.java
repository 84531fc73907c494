package com.z254.horizon.domain.model;

import com.z254.horizon.domain.exception.SignalValidationException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered numeric samples fed to pattern detection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataStream {

    @Builder.Default
    private List<Double> values = new ArrayList<>();

    @Builder.Default
    private double scale = 1.0;

    @Builder.Default
    private Set<StreamMarker> markers = EnumSet.noneOf(StreamMarker.class);

    public static DataStream of(List<Double> values) {
        return DataStream.builder().values(new ArrayList<>(values)).build();
    }

    /**
     * Flatten a snapshot into a stream of signal magnitudes, in family order.
     */
    public static DataStream fromSnapshot(SignalSnapshot snapshot) {
        snapshot.validate();
        List<Double> values = new ArrayList<>();
        snapshot.getMarketSignals().forEach(s -> values.add(s.strength()));
        snapshot.getTechnologyTrends().forEach(t -> values.add(magnitude(t.impact())));
        snapshot.getRegulatoryUpdates().forEach(r -> values.add(magnitude(r.impact())));
        snapshot.getCompetitiveMoves().forEach(c -> values.add(magnitude(c.threatLevel())));

        Set<StreamMarker> markers = EnumSet.noneOf(StreamMarker.class);
        if (!snapshot.getRegulatoryUpdates().isEmpty()) {
            markers.add(StreamMarker.SPATIAL_DISTRIBUTION);
        }
        if (!snapshot.getCompetitiveMoves().isEmpty()) {
            markers.add(StreamMarker.BEHAVIORAL_SIGNATURE);
        }
        return DataStream.builder()
                .values(values)
                .scale(snapshot.getCoverage() > 0 ? snapshot.getCoverage() : 1.0)
                .markers(markers)
                .build();
    }

    public boolean hasMarker(StreamMarker marker) {
        return markers != null && markers.contains(marker);
    }

    /**
     * @throws SignalValidationException if values are missing or not finite
     */
    public void validate() {
        if (values == null) {
            throw SignalValidationException.missing("values");
        }
        for (Double value : values) {
            if (value == null || !Double.isFinite(value)) {
                throw new SignalValidationException("values", "Stream contains a non-finite value");
            }
        }
    }

    private static double magnitude(SignalLevel level) {
        return level != null ? level.getMagnitude() : SignalLevel.LOW.getMagnitude();
    }
}
