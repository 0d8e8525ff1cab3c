package com.airsentinel.ingester.opensky;

/**
 * Flight seen arriving at or departing from an airport.
 *
 * @param icao24 aircraft identifier
 * @param callsign trimmed callsign, may be {@code null}
 * @param firstSeen first contact (epoch seconds)
 * @param lastSeen last contact (epoch seconds)
 * @param estDepartureAirport estimated departure airport ICAO code, may be {@code null}
 * @param estArrivalAirport estimated arrival airport ICAO code, may be {@code null}
 */
public record AirportFlight(
    String icao24,
    String callsign,
    Long firstSeen,
    Long lastSeen,
    String estDepartureAirport,
    String estArrivalAirport) {}
