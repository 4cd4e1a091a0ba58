/**
 * LabArchives notebook destination.
 */
package courier.destination.labarchives;
