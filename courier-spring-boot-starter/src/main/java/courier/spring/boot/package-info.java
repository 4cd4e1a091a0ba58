/**
 * Spring Boot auto-configuration for courier.
 */
package courier.spring.boot;
