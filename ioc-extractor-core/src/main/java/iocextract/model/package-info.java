/**
 * Value types flowing through an extraction run: the raw {@link iocextract.model.SourceRow},
 * the canonical {@link iocextract.model.IocRecord} and the
 * {@link iocextract.model.ExtractionWindow} a run queries.
 */
package iocextract.model;
