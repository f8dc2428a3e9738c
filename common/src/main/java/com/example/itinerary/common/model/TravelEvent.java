package com.example.itinerary.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public final class TravelEvent extends ItineraryEvent {
    private DatedLocation departure = DatedLocation.empty();
    private DatedLocation arrival = DatedLocation.empty();
    private String airline;
    private String flightNumber;
    private String trainNumber;
    private String seat;
    private String car;
    private String travelClass;
    private String bookingReference;

    @Override
    public EventCategory getCategory() {
        return EventCategory.TRAVEL;
    }

    @Override
    public <R> R accept(EventVisitor<R> visitor) {
        return visitor.visitTravel(this);
    }

    public DatedLocation getDeparture() { return departure; }
    public void setDeparture(DatedLocation departure) { this.departure = departure != null ? departure : DatedLocation.empty(); }

    public DatedLocation getArrival() { return arrival; }
    public void setArrival(DatedLocation arrival) { this.arrival = arrival != null ? arrival : DatedLocation.empty(); }

    public String getAirline() { return airline; }
    public void setAirline(String airline) { this.airline = airline; }

    public String getFlightNumber() { return flightNumber; }
    public void setFlightNumber(String flightNumber) { this.flightNumber = flightNumber; }

    public String getTrainNumber() { return trainNumber; }
    public void setTrainNumber(String trainNumber) { this.trainNumber = trainNumber; }

    public String getSeat() { return seat; }
    public void setSeat(String seat) { this.seat = seat; }

    public String getCar() { return car; }
    public void setCar(String car) { this.car = car; }

    @JsonProperty("class")
    public String getTravelClass() { return travelClass; }
    @JsonProperty("class")
    public void setTravelClass(String travelClass) { this.travelClass = travelClass; }

    public String getBookingReference() { return bookingReference; }
    public void setBookingReference(String bookingReference) { this.bookingReference = bookingReference; }
}
