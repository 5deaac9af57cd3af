package iocextract.spi;

import iocextract.model.ExtractionWindow;
import iocextract.model.SourceRow;

import java.sql.Connection;
import java.util.List;
import java.util.Set;

/**
 * Reads joined (event, attribute) rows from a MISP database.
 *
 * <p>Implementations must issue a single query per call, return only attributes of the given
 * types whose last modification lies inside the window, and order rows by attribute id
 * ascending.
 */
public interface SourceReader {

  /**
   * Returns all rows matching the window and type allowlist.
   *
   * @param conn           open source connection, owned by the caller
   * @param window         closed interval on the attribute timestamp
   * @param attributeTypes non-empty allowlist of MISP attribute types
   * @return rows ordered by attribute id ascending
   * @throws iocextract.SourceConnectionException if the connection fails during the query
   * @throws iocextract.SourceQueryException if the query fails or times out
   */
  List<SourceRow> read(Connection conn, ExtractionWindow window, Set<String> attributeTypes);
}
