/**
 * Optional in-process trigger for deployments without an external scheduler.
 */
package iocextract.schedule;
