package org.mides.pooling.data;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mides.pooling.grasp.TravelTimeCalculator;
import org.mides.pooling.model.Coordinate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TripRecordReaderTest {

    private static final String HEADER = "VendorID,tpep_pickup_datetime,tpep_dropoff_datetime,passenger_count,"
        + "trip_distance,pickup_longitude,pickup_latitude,RateCodeID,store_and_fwd_flag,"
        + "dropoff_longitude,dropoff_latitude,payment_type,fare_amount";

    @TempDir
    Path tempDir;

    private final TripRecordReader reader = new TripRecordReader(new TravelTimeCalculator(40.0));

    private Path write(String... rows) throws IOException {
        var file = tempDir.resolve("trips.csv");
        var lines = new ArrayList<String>();
        lines.add(HEADER);
        lines.addAll(List.of(rows));
        Files.write(file, lines);
        return file;
    }

    @Test
    void read_shouldFilterAndSortTrips() throws IOException {
        var file = write(
            "2,2015-01-15 19:05:39,2015-01-15 19:23:42,1,1.59,-73.993896,40.750111,1,N,-73.974785,40.750618,1,12",
            "1,2015-01-15 08:00:00,2015-01-15 08:10:00,1,1.00,-73.990000,40.750000,1,N,-73.980000,40.770000,1,7.5",
            // zero coordinate
            "1,2015-01-15 09:00:00,2015-01-15 09:10:00,1,1.00,0,0,1,N,-73.980000,40.770000,1,5",
            // pickup equals dropoff
            "1,2015-01-15 10:00:00,2015-01-15 10:10:00,1,0.00,-73.980000,40.770000,1,N,-73.980000,40.770000,1,3",
            // more than twelve hours of direct driving
            "1,2015-01-15 11:00:00,2015-01-15 11:10:00,1,1.00,-73.990000,40.750000,1,N,-73.990000,20.000000,1,9",
            // no fare column
            "1,2015-01-15 12:30:00,2015-01-15 12:40:00,1,1.00,-73.990000,40.750000,1,N,-73.980000,40.770000");

        var trips = reader.read(file);

        assertEquals(3, trips.size());
        assertEquals(Duration.ofHours(8), trips.get(0).getPickupTime());
        assertEquals(Duration.ofHours(12).plusMinutes(30), trips.get(1).getPickupTime());
        assertEquals(Duration.ofSeconds(19 * 3600 + 5 * 60 + 39), trips.get(2).getPickupTime());

        assertEquals(Coordinate.of(40.75, -73.99), trips.get(0).getPickup());
        assertEquals(Coordinate.of(40.77, -73.98), trips.get(0).getDropoff());
        assertEquals(7.5, trips.get(0).getFare());
        assertNull(trips.get(1).getFare());
        assertEquals(12.0, trips.get(2).getFare());
    }

    @Test
    void read_malformedRows_shouldBeSkipped() throws IOException {
        var file = write(
            "1,not a date,2015-01-15 08:10:00,1,1.00,-73.990000,40.750000,1,N,-73.980000,40.770000,1,7.5",
            "1,2015-01-15 08:00:00,2015-01-15 08:10:00,1,1.00,abc,40.750000,1,N,-73.980000,40.770000,1,7.5",
            "1,2015-01-15 08:00:00",
            "1,2015-01-15 08:05:00,2015-01-15 08:10:00,1,1.00,-73.990000,40.750000,1,N,-73.980000,40.770000,1,7.5");

        var trips = reader.read(file);

        assertEquals(1, trips.size());
        assertEquals(Duration.ofHours(8).plusMinutes(5), trips.get(0).getPickupTime());
    }

    @Test
    void read_withLimit_shouldOnlyConsiderFirstRows() throws IOException {
        var file = write(
            "1,2015-01-15 08:00:00,2015-01-15 08:10:00,1,1.00,0,0,1,N,-73.980000,40.770000,1,5",
            "1,2015-01-15 08:05:00,2015-01-15 08:10:00,1,1.00,-73.990000,40.750000,1,N,-73.980000,40.770000,1,7.5",
            "1,2015-01-15 08:10:00,2015-01-15 08:20:00,1,1.00,-73.990000,40.750000,1,N,-73.980000,40.770000,1,7.5");

        var trips = reader.read(file, 2);

        assertEquals(1, trips.size());
        assertEquals(Duration.ofHours(8).plusMinutes(5), trips.get(0).getPickupTime());
    }

    @Test
    void read_missingFile_shouldThrowUncheckedIOException() {
        assertThrows(UncheckedIOException.class, () -> reader.read(tempDir.resolve("missing.csv")));
    }
}
