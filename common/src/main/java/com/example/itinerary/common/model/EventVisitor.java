package com.example.itinerary.common.model;

/**
 * Exhaustive dispatch over the four event variants.
 */
public interface EventVisitor<R> {
    R visitTravel(TravelEvent event);
    R visitAccommodation(AccommodationEvent event);
    R visitExperience(ExperienceEvent event);
    R visitMeal(MealEvent event);
}
