package ai.i18next.parser.entry;

import java.util.List;

/**
 * Supplies the entries extracted from application source code.
 */
@FunctionalInterface
public interface EntrySource {

    /**
     * @throws EntrySourceException when the entries cannot be obtained
     */
    List<Entry> read();
}
