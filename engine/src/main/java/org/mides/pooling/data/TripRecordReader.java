package org.mides.pooling.data;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.mides.pooling.grasp.TravelTimeCalculator;
import org.mides.pooling.model.Coordinate;
import org.mides.pooling.model.TripRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reads NYC yellow taxi trip records. Only the time of day of the pickup is
 * kept; rows with missing coordinates, identical endpoints or an implausibly
 * long direct trip are dropped.
 */
public class TripRecordReader {

    private static final Logger logger = LoggerFactory.getLogger(TripRecordReader.class);

    private static final DateTimeFormatter PICKUP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final Duration MAX_DIRECT_TRIP = Duration.ofHours(12);

    private static final int PICKUP_DATETIME = 1;
    private static final int PICKUP_LONGITUDE = 5;
    private static final int PICKUP_LATITUDE = 6;
    private static final int DROPOFF_LONGITUDE = 9;
    private static final int DROPOFF_LATITUDE = 10;
    private static final int FARE_AMOUNT = 12;

    private final TravelTimeCalculator travelTimes;

    public TripRecordReader(TravelTimeCalculator travelTimes) {
        this.travelTimes = travelTimes;
    }

    public List<TripRecord> read(Path path) {
        return read(path, null);
    }

    /**
     * @param limit data rows to read, filtered ones included; all rows when null
     * @return the kept trips ordered by pickup time
     */
    public List<TripRecord> read(Path path, Integer limit) {
        var trips = new ArrayList<TripRecord>();
        int rows = 0;
        int skipped = 0;

        try (var parser = CSVParser.parse(path, StandardCharsets.UTF_8, CSVFormat.DEFAULT)) {
            boolean header = true;
            for (CSVRecord record : parser) {
                if (header) {
                    header = false;
                    continue;
                }
                if (limit != null && rows >= limit)
                    break;
                rows++;

                try {
                    var trip = parse(record);
                    if (isKept(trip))
                        trips.add(trip);
                } catch (DateTimeParseException | NumberFormatException | ArrayIndexOutOfBoundsException e) {
                    skipped++;
                    logger.warn("Skipping malformed trip record on line {}: {}", record.getRecordNumber(), e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read trip records from " + path, e);
        }

        trips.sort(Comparator.comparing(TripRecord::getPickupTime));
        logger.info("Read {} trip records from {}: {} kept, {} malformed", rows, path, trips.size(), skipped);
        return trips;
    }

    private static TripRecord parse(CSVRecord record) {
        var pickupTime = LocalDateTime.parse(record.get(PICKUP_DATETIME).trim(), PICKUP_FORMAT).toLocalTime();
        var pickup = Coordinate.of(
            Double.parseDouble(record.get(PICKUP_LATITUDE)),
            Double.parseDouble(record.get(PICKUP_LONGITUDE)));
        var dropoff = Coordinate.of(
            Double.parseDouble(record.get(DROPOFF_LATITUDE)),
            Double.parseDouble(record.get(DROPOFF_LONGITUDE)));

        Double fare = null;
        if (record.size() > FARE_AMOUNT && !record.get(FARE_AMOUNT).isBlank())
            fare = Double.parseDouble(record.get(FARE_AMOUNT));

        return new TripRecord(Duration.ofSeconds(pickupTime.toSecondOfDay()), pickup, dropoff, fare);
    }

    private boolean isKept(TripRecord trip) {
        if (trip.getPickup().hasZeroComponent() || trip.getDropoff().hasZeroComponent())
            return false;
        if (trip.getPickup().equals(trip.getDropoff()))
            return false;
        return travelTimes.travelTime(trip.getPickup(), trip.getDropoff()) <= MAX_DIRECT_TRIP.getSeconds();
    }
}
