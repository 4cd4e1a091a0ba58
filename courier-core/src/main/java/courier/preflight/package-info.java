/**
 * Advisory destination checks run before a batch.
 */
package courier.preflight;
