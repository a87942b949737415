//******************************************************************************
//
// Title:       Force Field X.
// Description: Force Field X - Software for Molecular Biophysics.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2025.
//
// This file is part of Force Field X.
//
// Force Field X is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// Force Field X is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// Force Field X; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
//******************************************************************************
package fftrim.potential.parsers;

import fftrim.potential.parameters.ForceField;
import fftrim.potential.parameters.ForceFieldException;
import fftrim.potential.trim.TrimResult;
import org.apache.commons.configuration2.CompositeConfiguration;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import javax.xml.stream.XMLStreamWriter;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static java.lang.String.format;

/**
 * The TrimmedXmlFilter writes the records of a {@link TrimResult} into the sections of the blank
 * force field template, so the trimmed document has the same sections as the source document.
 * <p>
 * Every record is written with its attributes in the order they were read from the source.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class TrimmedXmlFilter {

  private static final Logger logger = Logger.getLogger(TrimmedXmlFilter.class.getName());

  /**
   * Classpath location of the blank template.
   */
  public static final String TEMPLATE = "fftrim/potential/parsers/blank.xml";
  /**
   * Default number of spaces per indentation level.
   */
  public static final int DEFAULT_INDENT = 2;

  private final ForceField forceField;
  private final TrimResult result;
  private final int indent;

  /**
   * TrimmedXmlFilter constructor.
   *
   * @param forceField the source force field, for root and section attributes.
   * @param result     the trimmed records.
   * @param properties read for <code>xml-indent</code>; may be null.
   */
  public TrimmedXmlFilter(ForceField forceField, TrimResult result,
                          CompositeConfiguration properties) {
    this.forceField = forceField;
    this.result = result;
    int value = DEFAULT_INDENT;
    if (properties != null) {
      value = properties.getInt("xml-indent", DEFAULT_INDENT);
    }
    if (value < 0) {
      logger.warning(format(" Ignoring negative xml-indent %d.", value));
      value = DEFAULT_INDENT;
    }
    this.indent = value;
  }

  /**
   * Write the trimmed document to a file.
   *
   * @param file the output file.
   * @throws IOException if the file cannot be written.
   */
  public void writeFile(File file) throws IOException {
    try (OutputStream outputStream = Files.newOutputStream(file.toPath())) {
      write(outputStream);
    }
    logger.info(format(" Wrote %d records to %s.", result.getEntries().size(), file));
  }

  /**
   * Write the trimmed document to a stream as UTF-8.
   *
   * @param outputStream the stream.
   * @throws IOException if the document cannot be written.
   */
  public void write(OutputStream outputStream) throws IOException {
    try {
      XMLStreamWriter writer = XMLOutputFactory.newInstance()
          .createXMLStreamWriter(outputStream, StandardCharsets.UTF_8.name());
      write(writer);
    } catch (XMLStreamException e) {
      throw new IOException(" The trimmed force field could not be written.", e);
    }
  }

  /**
   * The trimmed document as a String.
   *
   * @return the XML text.
   */
  public String toXML() {
    StringWriter stringWriter = new StringWriter();
    try {
      write(XMLOutputFactory.newInstance().createXMLStreamWriter(stringWriter));
    } catch (XMLStreamException e) {
      throw new ForceFieldException(" The trimmed force field could not be serialized.", e);
    }
    return stringWriter.toString();
  }

  private void write(XMLStreamWriter writer) throws XMLStreamException {
    Template template = loadTemplate();
    Map<String, List<TrimResult.Entry>> sections = new LinkedHashMap<>();
    for (String section : template.sections) {
      sections.put(section, new ArrayList<>());
    }
    for (TrimResult.Entry entry : result.getEntries()) {
      if (!sections.containsKey(entry.section)) {
        logger.fine(format(" Adding section %s to the template.", entry.section));
      }
      sections.computeIfAbsent(entry.section, k -> new ArrayList<>()).add(entry);
    }

    writer.writeStartDocument(StandardCharsets.UTF_8.name(), "1.0");
    newLine(writer, 0);
    writer.writeStartElement(template.root);
    writeAttributes(writer, forceField.getRootAttributes());
    for (Map.Entry<String, List<TrimResult.Entry>> section : sections.entrySet()) {
      String name = section.getKey();
      List<TrimResult.Entry> entries = section.getValue();
      newLine(writer, 1);
      if (entries.isEmpty()) {
        writer.writeEmptyElement(name);
        writeAttributes(writer, forceField.getSectionAttributes(name));
        continue;
      }
      writer.writeStartElement(name);
      writeAttributes(writer, forceField.getSectionAttributes(name));
      for (TrimResult.Entry entry : entries) {
        newLine(writer, 2);
        writer.writeEmptyElement(entry.tag);
        writeAttributes(writer, entry.attributes);
      }
      newLine(writer, 1);
      writer.writeEndElement();
    }
    newLine(writer, 0);
    writer.writeEndElement();
    writer.writeCharacters("\n");
    writer.writeEndDocument();
    writer.flush();
    writer.close();
  }

  private void newLine(XMLStreamWriter writer, int level) throws XMLStreamException {
    writer.writeCharacters("\n" + " ".repeat(indent * level));
  }

  private static void writeAttributes(XMLStreamWriter writer, Map<String, String> attributes)
      throws XMLStreamException {
    for (Map.Entry<String, String> attribute : attributes.entrySet()) {
      writer.writeAttribute(attribute.getKey(), attribute.getValue());
    }
  }

  /**
   * The root element name and section names of the blank template.
   */
  private static final class Template {

    private String root = null;
    private final List<String> sections = new ArrayList<>();
  }

  private static Template loadTemplate() {
    ClassLoader classLoader = TrimmedXmlFilter.class.getClassLoader();
    try (InputStream inputStream = classLoader.getResourceAsStream(TEMPLATE)) {
      if (inputStream == null) {
        throw new ForceFieldException(format(" Template %s was not found.", TEMPLATE));
      }
      XMLStreamReader reader = XMLInputFactory.newInstance().createXMLStreamReader(inputStream);
      Template template = new Template();
      int depth = 0;
      while (reader.hasNext()) {
        int event = reader.next();
        if (event == XMLStreamConstants.START_ELEMENT) {
          if (depth == 0) {
            template.root = reader.getLocalName();
          } else if (depth == 1) {
            template.sections.add(reader.getLocalName());
          }
          depth++;
        } else if (event == XMLStreamConstants.END_ELEMENT) {
          depth--;
        }
      }
      reader.close();
      return template;
    } catch (XMLStreamException | IOException e) {
      throw new ForceFieldException(format(" Template %s could not be loaded.", TEMPLATE), e);
    }
  }
}
