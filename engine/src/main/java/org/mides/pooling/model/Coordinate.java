package org.mides.pooling.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class Coordinate {
    @NotNull
    @JsonProperty("latitude")
    Double latitude;

    @NotNull
    @JsonProperty("longitude")
    Double longitude;

    @JsonCreator
    public Coordinate(
        @JsonProperty("latitude") Double latitude,
        @JsonProperty("longitude") Double longitude)
    {
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public static Coordinate of(double latitude, double longitude) {
        return new Coordinate(latitude, longitude);
    }

    /* Raw taxi records use 0 for a missing coordinate. */
    public boolean hasZeroComponent() {
        return latitude == 0.0 || longitude == 0.0;
    }

    @Override
    public String toString() {
        return String.format("%.8f,%.8f", longitude, latitude);
    }
}
