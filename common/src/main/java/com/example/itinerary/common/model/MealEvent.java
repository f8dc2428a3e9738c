package com.example.itinerary.common.model;

public final class MealEvent extends ItineraryEvent {
    private String date = "";
    private String reservationReference;

    @Override
    public EventCategory getCategory() {
        return EventCategory.MEAL;
    }

    @Override
    public <R> R accept(EventVisitor<R> visitor) {
        return visitor.visitMeal(this);
    }

    public String getDate() { return date; }
    public void setDate(String date) { this.date = date != null ? date : ""; }

    public String getReservationReference() { return reservationReference; }
    public void setReservationReference(String reservationReference) { this.reservationReference = reservationReference; }
}
