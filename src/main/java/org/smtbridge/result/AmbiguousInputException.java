package org.smtbridge.result;

import lombok.Getter;
import org.smtbridge.core.NamedSymVar;

import java.util.List;

/**
 * 一个 s&lt;id&gt; 对应了多个输入。
 */
@Getter
public class AmbiguousInputException extends ModelExtractionException {

    private final String reference;
    private final List<NamedSymVar> matches;

    public AmbiguousInputException(String reference, List<NamedSymVar> matches, String line) {
        super("Cannot uniquely identify value for " + reference + " in " + matches, line);
        this.reference = reference;
        this.matches = List.copyOf(matches);
    }
}
