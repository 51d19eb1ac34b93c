package org.mides.pooling.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.mides.pooling.converter.InsertionMethodDeserializer;

@JsonDeserialize(using = InsertionMethodDeserializer.class)
public enum InsertionMethod {
    /* Cheapest feasible insertion over every route and position pair (IA). */
    EXHAUSTIVE,
    /* Uniform pick among the cheapest beta share of feasible insertions (IB). */
    RANDOMIZED_RESTRICTED
}
