/**
 * Export strategies and the executor that applies them to an ordered destination list.
 */
package courier.strategy;
