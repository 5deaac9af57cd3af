/**
 * Conversion of raw source rows into canonical IOC records.
 */
package iocextract.normalize;
