package structured.error.core.codec;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import structured.error.core.domain.model.AttachmentNode;
import structured.error.core.domain.model.ContextNode;
import structured.error.core.domain.model.ErrorChild;
import structured.error.core.domain.model.ErrorNode;
import structured.error.global.error.exception.ErrorTreeParseException;

/**
 * 에러 트리 ↔ 텍스트 변환기
 *
 * <p>프레임 경계를 넘는 유일한 계약이므로 형식은 고정입니다. 속성/요소 이름은 길이 예산을 아끼기 위해 한 글자로 유지합니다.
 *
 * <pre>
 * &lt;E N="1002" M="사용자 메시지" D="개발자 메시지" P="ErrorHandler" L="12"&gt;
 *   &lt;T EntityId="10" EntityType="Article"/&gt;
 *   &lt;E N="..." M="..." P="..."/&gt;
 * &lt;/E&gt;
 * </pre>
 *
 * <ul>
 *   <li>E 요소 속성은 N, M, D, P, L 순서로 출력 (해석 시 순서 무관)
 *   <li>자식 순서는 그대로 보존
 *   <li>T/E 이외의 요소는 {@link AttachmentNode}로 보존
 *   <li>공백만 있는 텍스트는 무시
 * </ul>
 *
 * <p>{@code decode(encode(t)).equals(t)}가 성립하도록 개행/탭도 문자 참조로 이스케이프합니다. 단, XML 1.0이 담을 수 없는
 * 문자(탭/CR/LF를 제외한 0x20 미만 제어 문자, U+FFFE, U+FFFF)는 U+FFFD로 바뀌므로 이런 문자가 섞인 원문은 왕복 시 손실됩니다.
 */
public final class ErrorTreeCodec {

  public static final String ATTR_CODE = "N";
  public static final String ATTR_USER_MESSAGE = "M";
  public static final String ATTR_DEVELOPER_MESSAGE = "D";
  public static final String ATTR_PROCEDURE = "P";
  public static final String ATTR_LINE = "L";

  private static final XMLInputFactory INPUT_FACTORY = createInputFactory();

  private ErrorTreeCodec() {}

  // ==================== Encode ====================

  public static String encode(ErrorNode node) {
    StringBuilder sb = new StringBuilder(256);
    writeError(sb, node);
    return sb.toString();
  }

  private static void writeError(StringBuilder sb, ErrorNode node) {
    sb.append('<').append(ErrorNode.ELEMENT);
    writeAttribute(sb, ATTR_CODE, Integer.toString(node.code()));
    writeAttribute(sb, ATTR_USER_MESSAGE, node.userMessage());
    writeAttribute(sb, ATTR_DEVELOPER_MESSAGE, node.developerMessage());
    writeAttribute(sb, ATTR_PROCEDURE, node.sourceProcedure());
    writeAttribute(sb, ATTR_LINE, node.sourceLine());
    if (node.children().isEmpty()) {
      sb.append("/>");
      return;
    }
    sb.append('>');
    for (ErrorChild child : node.children()) {
      writeChild(sb, child);
    }
    sb.append("</").append(ErrorNode.ELEMENT).append('>');
  }

  private static void writeChild(StringBuilder sb, ErrorChild child) {
    if (child instanceof ErrorNode error) {
      writeError(sb, error);
    } else if (child instanceof ContextNode context) {
      sb.append('<').append(ContextNode.ELEMENT);
      context.attributes().forEach((name, value) -> writeAttribute(sb, name, value));
      sb.append("/>");
    } else if (child instanceof AttachmentNode attachment) {
      writeAttachment(sb, attachment);
    } else {
      throw new IllegalArgumentException("Unsupported child: " + child.getClass().getName());
    }
  }

  private static void writeAttachment(StringBuilder sb, AttachmentNode node) {
    sb.append('<').append(node.name());
    node.attributes().forEach((name, value) -> writeAttribute(sb, name, value));
    if (node.text() == null && node.children().isEmpty()) {
      sb.append("/>");
      return;
    }
    sb.append('>');
    if (node.text() != null) {
      escape(sb, node.text());
    }
    for (AttachmentNode child : node.children()) {
      writeAttachment(sb, child);
    }
    sb.append("</").append(node.name()).append('>');
  }

  private static void writeAttribute(StringBuilder sb, String name, String value) {
    if (value == null) {
      return;
    }
    sb.append(' ').append(name).append("=\"");
    escape(sb, value);
    sb.append('"');
  }

  private static void escape(StringBuilder sb, String value) {
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '&' -> sb.append("&amp;");
        case '<' -> sb.append("&lt;");
        case '>' -> sb.append("&gt;");
        case '"' -> sb.append("&quot;");
        case '\'' -> sb.append("&apos;");
        case '\n' -> sb.append("&#10;");
        case '\r' -> sb.append("&#13;");
        case '\t' -> sb.append("&#9;");
        default -> sb.append(isXmlChar(c) ? c : '\uFFFD');
      }
    }
  }

  private static boolean isXmlChar(char c) {
    return c >= 0x20 && c != 0xFFFE && c != 0xFFFF;
  }

  // ==================== Decode ====================

  /** 텍스트가 에러 트리 형식으로 보이는지 (첫 비공백 문자가 {@code <}) */
  public static boolean looksEncoded(String text) {
    return text != null && text.stripLeading().startsWith("<");
  }

  /** 해석 가능하면 트리, 아니면 empty (예외 없음) */
  public static Optional<ErrorNode> tryDecode(String text) {
    if (!looksEncoded(text)) {
      return Optional.empty();
    }
    try {
      return Optional.of(decode(text));
    } catch (ErrorTreeParseException e) {
      return Optional.empty();
    }
  }

  /**
   * 텍스트를 에러 트리로 해석
   *
   * @throws ErrorTreeParseException 루트가 E가 아니거나 XML이 올바르지 않은 경우
   */
  public static ErrorNode decode(String text) {
    if (text == null) {
      throw new ErrorTreeParseException("null text");
    }
    XMLStreamReader reader = null;
    try {
      reader = INPUT_FACTORY.createXMLStreamReader(new StringReader(text.strip()));
      reader.nextTag();
      if (!ErrorNode.ELEMENT.equals(reader.getLocalName())) {
        throw new ErrorTreeParseException("root element must be E but was " + reader.getLocalName());
      }
      ErrorNode root = readError(reader);
      ensureNoTrailingElement(reader);
      return root;
    } catch (XMLStreamException e) {
      throw new ErrorTreeParseException(e.getMessage(), e);
    } finally {
      closeQuietly(reader);
    }
  }

  private static ErrorNode readError(XMLStreamReader reader) throws XMLStreamException {
    Map<String, String> attributes = readAttributes(reader);
    String code = attributes.get(ATTR_CODE);
    if (code == null) {
      throw new ErrorTreeParseException("E element without N attribute");
    }
    int parsedCode;
    try {
      parsedCode = Integer.parseInt(code.trim());
    } catch (NumberFormatException e) {
      throw new ErrorTreeParseException("non-numeric N attribute: " + code, e);
    }
    List<ErrorChild> children = new ArrayList<>();
    while (reader.next() != XMLStreamConstants.END_ELEMENT) {
      if (reader.getEventType() != XMLStreamConstants.START_ELEMENT) {
        continue;
      }
      String name = reader.getLocalName();
      if (ErrorNode.ELEMENT.equals(name)) {
        children.add(readError(reader));
      } else if (ContextNode.ELEMENT.equals(name)) {
        children.add(new ContextNode(readAttributes(reader)));
        skipToEnd(reader);
      } else {
        children.add(readAttachment(reader));
      }
    }
    return new ErrorNode(
        parsedCode,
        attributes.get(ATTR_USER_MESSAGE),
        attributes.get(ATTR_DEVELOPER_MESSAGE),
        attributes.get(ATTR_PROCEDURE),
        attributes.get(ATTR_LINE),
        children);
  }

  private static AttachmentNode readAttachment(XMLStreamReader reader) throws XMLStreamException {
    String name = reader.getLocalName();
    Map<String, String> attributes = readAttributes(reader);
    StringBuilder text = new StringBuilder();
    List<AttachmentNode> children = new ArrayList<>();
    while (reader.next() != XMLStreamConstants.END_ELEMENT) {
      switch (reader.getEventType()) {
        case XMLStreamConstants.START_ELEMENT -> children.add(readAttachment(reader));
        case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA -> text.append(reader.getText());
        default -> {
          // 주석, 처리 명령 등은 버림
        }
      }
    }
    String content = text.toString().isBlank() ? null : text.toString();
    return new AttachmentNode(name, attributes, content, children);
  }

  private static Map<String, String> readAttributes(XMLStreamReader reader) {
    Map<String, String> attributes = new LinkedHashMap<>();
    for (int i = 0; i < reader.getAttributeCount(); i++) {
      attributes.put(reader.getAttributeLocalName(i), reader.getAttributeValue(i));
    }
    return attributes;
  }

  /** T 요소 내부는 속성만 의미가 있으므로 끝까지 건너뜀 */
  private static void skipToEnd(XMLStreamReader reader) throws XMLStreamException {
    int depth = 1;
    while (depth > 0) {
      int event = reader.next();
      if (event == XMLStreamConstants.START_ELEMENT) {
        depth++;
      } else if (event == XMLStreamConstants.END_ELEMENT) {
        depth--;
      }
    }
  }

  private static void ensureNoTrailingElement(XMLStreamReader reader) throws XMLStreamException {
    while (reader.hasNext()) {
      if (reader.next() == XMLStreamConstants.START_ELEMENT) {
        throw new ErrorTreeParseException("multiple root elements");
      }
    }
  }

  private static void closeQuietly(XMLStreamReader reader) {
    if (reader == null) {
      return;
    }
    try {
      reader.close();
    } catch (XMLStreamException e) {
      // StringReader 기반이라 해제할 외부 자원이 없음
    }
  }

  private static XMLInputFactory createInputFactory() {
    XMLInputFactory factory = XMLInputFactory.newFactory();
    factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
    factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
    factory.setProperty(XMLInputFactory.IS_COALESCING, true);
    // xmlns로 시작하는 속성도 일반 T 속성으로 읽음
    factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, false);
    return factory;
  }
}
