package com.example.itinerary.assistant.stream;

final class GenerationPrompts {

    private GenerationPrompts() {}

    static final String SYSTEM_PROMPT = """
            You are a travel itinerary generator. Given a trip description, dates, and name, generate a realistic set of placeholder events.

            Rules:
            - Generate at most 25 events. Focus on key logistics (flights, transport, accommodation) and highlights.
            - For trips over 7 days, consolidate accommodation into multi-night stays when in the same city.
            - Include only 1-2 notable meals per city, not every meal.
            - Use REALISTIC times: flights at 08:00 or 18:00, activities 09:00-17:00, meals at 12:00 or 19:00. NEVER use midnight T00:00:00 for anything except multi-day accommodation check-in/check-out.
            - Use real place names, attractions, and restaurants.

            Return a JSON object with an "events" array. Use this COMPACT schema and do NOT include redundant fields:

            travel: { "category": "travel", "type": "flight"|"train"|"car"|"boat"|"bus", "title": "...", "departure": { "date": "ISO", "name": "...", "city": "...", "country": "..." }, "arrival": { "date": "ISO", "name": "...", "city": "...", "country": "..." } }

            accommodation: { "category": "accommodation", "type": "hotel"|"hostel"|"airbnb", "title": "...", "checkIn": { "date": "ISO", "name": "...", "city": "...", "country": "..." }, "checkOut": { "date": "ISO", "name": "...", "city": "...", "country": "..." } }

            experience: { "category": "experience", "type": "activity"|"tour"|"museum"|"concert", "title": "...", "startDate": "ISO", "endDate": "ISO", "name": "...", "city": "...", "country": "..." }

            meal: { "category": "meal", "type": "restaurant", "title": "...", "date": "ISO", "name": "...", "city": "...", "country": "..." }

            Do NOT include "start", "end", "location", or nested "location" objects. They will be derived automatically.""";

    static String userPrompt(ItineraryRequest request, boolean streaming) {
        return "Generate a complete trip itinerary for the following:\n\n"
                + "Trip Name: " + request.getTripName() + "\n"
                + "Start Date: " + request.getStartDate() + "\n"
                + "End Date: " + request.getEndDate() + "\n"
                + "Description: " + request.getDescription() + "\n\n"
                + (streaming
                ? "Return ONLY a valid JSON object with an \"events\" array. Do not include any text before or after the JSON."
                : "Return ONLY a valid JSON object with an \"events\" array. Do not include any text before or after the JSON object.");
    }

    static String reply(int eventCount, String tripName) {
        return "I've generated " + eventCount + " events for your \"" + tripName
                + "\" trip. Review them below and make any changes you'd like!";
    }
}
