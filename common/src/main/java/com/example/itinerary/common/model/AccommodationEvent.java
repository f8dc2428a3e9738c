package com.example.itinerary.common.model;

public final class AccommodationEvent extends ItineraryEvent {
    private DatedLocation checkIn = DatedLocation.empty();
    private DatedLocation checkOut = DatedLocation.empty();
    private String placeName = "";
    private String roomNumber;
    private String bookingReference;

    @Override
    public EventCategory getCategory() {
        return EventCategory.ACCOMMODATION;
    }

    @Override
    public <R> R accept(EventVisitor<R> visitor) {
        return visitor.visitAccommodation(this);
    }

    public DatedLocation getCheckIn() { return checkIn; }
    public void setCheckIn(DatedLocation checkIn) { this.checkIn = checkIn != null ? checkIn : DatedLocation.empty(); }

    public DatedLocation getCheckOut() { return checkOut; }
    public void setCheckOut(DatedLocation checkOut) { this.checkOut = checkOut != null ? checkOut : DatedLocation.empty(); }

    public String getPlaceName() { return placeName; }
    public void setPlaceName(String placeName) { this.placeName = placeName != null ? placeName : ""; }

    public String getRoomNumber() { return roomNumber; }
    public void setRoomNumber(String roomNumber) { this.roomNumber = roomNumber; }

    public String getBookingReference() { return bookingReference; }
    public void setBookingReference(String bookingReference) { this.bookingReference = bookingReference; }
}
