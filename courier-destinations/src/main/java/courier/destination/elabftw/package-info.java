/**
 * eLabFTW destination and v2 API client.
 */
package courier.destination.elabftw;
