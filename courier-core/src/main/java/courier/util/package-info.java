/**
 * Small dependency-free helpers.
 */
package courier.util;
