package com.example.itinerary.common.model;

public final class ExperienceEvent extends ItineraryEvent {
    private String startDate = "";
    private String endDate = "";
    private String bookingReference;

    @Override
    public EventCategory getCategory() {
        return EventCategory.EXPERIENCE;
    }

    @Override
    public <R> R accept(EventVisitor<R> visitor) {
        return visitor.visitExperience(this);
    }

    public String getStartDate() { return startDate; }
    public void setStartDate(String startDate) { this.startDate = startDate != null ? startDate : ""; }

    public String getEndDate() { return endDate; }
    public void setEndDate(String endDate) { this.endDate = endDate != null ? endDate : ""; }

    public String getBookingReference() { return bookingReference; }
    public void setBookingReference(String bookingReference) { this.bookingReference = bookingReference; }
}
