/**
 * MISP source access: the single joined events/attributes query and its row mapping.
 */
package iocextract.jdbc.source;
