/**
 * CDCS (Configurable Data Curation System) destination and REST client.
 */
package courier.destination.cdcs;
