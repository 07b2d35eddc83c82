// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.util.condition.exception;

import javax.xml.stream.XMLStreamException;
import org.jetbrains.annotations.NotNull;

/**
 * A condition type indicating that an XML document could not be parsed.
 */
public final class XMLStreamExceptionCondition extends ExceptionCondition<XMLStreamException> {
    /**
     * Initializes a new {@code XMLStreamExceptionCondition} representing the given {@link XMLStreamException}.
     */
    public XMLStreamExceptionCondition(final @NotNull XMLStreamException exception) {
        super(exception);
    }
}
