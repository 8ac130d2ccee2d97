package com.al.cdanormalizer.service.extraction;

import lombok.Value;
import org.w3c.dom.Element;

import java.util.List;

/**
 * A section element located in a structured document, with its header read.
 */
@Value
public class SectionNode {
    Element element;
    int index;
    String code;
    String codeSystem;
    String title;
    List<Element> entryElements;
}
