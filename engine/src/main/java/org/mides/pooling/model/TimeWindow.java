package org.mides.pooling.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import jakarta.validation.constraints.NotNull;
import lombok.Value;
import org.mides.pooling.converter.DurationDeserializer;
import org.mides.pooling.converter.DurationSerializer;

import java.time.Duration;

/**
 * Closed interval of service-day time. Bounds are offsets from midnight and
 * may be negative for windows opening before the day starts.
 */
@Value
public class TimeWindow {

    @NotNull
    @JsonProperty("start")
    @JsonSerialize(using = DurationSerializer.class)
    Duration start;

    @NotNull
    @JsonProperty("end")
    @JsonSerialize(using = DurationSerializer.class)
    Duration end;

    @JsonCreator
    public TimeWindow(
        @JsonProperty("start") @JsonDeserialize(using = DurationDeserializer.class) Duration start,
        @JsonProperty("end") @JsonDeserialize(using = DurationDeserializer.class) Duration end)
    {
        this.start = start;
        this.end = end;
    }

    public static TimeWindow ofSeconds(long startSeconds, long endSeconds) {
        return new TimeWindow(Duration.ofSeconds(startSeconds), Duration.ofSeconds(endSeconds));
    }

    public long startSeconds() {
        return start.getSeconds();
    }

    public long endSeconds() {
        return end.getSeconds();
    }

    public long lengthSeconds() {
        return endSeconds() - startSeconds();
    }

    public boolean contains(long seconds) {
        return seconds >= startSeconds() && seconds <= endSeconds();
    }
}
