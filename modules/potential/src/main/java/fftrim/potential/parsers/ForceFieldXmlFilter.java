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

import fftrim.potential.parameters.AtomType;
import fftrim.potential.parameters.ForceField;
import fftrim.potential.parameters.ForceFieldException;
import fftrim.potential.parameters.InteractionKind;
import fftrim.potential.parameters.NonbondedType;

import javax.xml.namespace.QName;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import static fftrim.potential.parameters.ForceField.ForceFieldType.ATOM;
import static fftrim.potential.parameters.ForceField.ForceFieldType.NONBONDED;
import static java.lang.String.format;

/**
 * The ForceFieldXmlFilter parses a force field XML document (the Foyer / OpenMM dialect) into a
 * {@link ForceField}.
 * <p>
 * The document is read as a stream so that the attributes of every record are collected in the
 * order they appear in the source.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class ForceFieldXmlFilter {

  private static final Logger logger = Logger.getLogger(ForceFieldXmlFilter.class.getName());

  /**
   * Section element whose Atom children are nonbonded records.
   */
  private static final String NONBONDED_FORCE = "NonbondedForce";

  private final File file;

  /**
   * ForceFieldXmlFilter constructor.
   *
   * @param file the force field XML file.
   */
  public ForceFieldXmlFilter(File file) {
    this.file = file;
  }

  /**
   * Parse the force field file.
   *
   * @return the ForceField.
   * @throws ForceFieldException if the file cannot be read or a record is malformed.
   */
  public ForceField parse() {
    if (file == null || !file.canRead()) {
      throw new ForceFieldException(format(" Force field file %s cannot be read.", file));
    }
    try (InputStream inputStream = Files.newInputStream(file.toPath())) {
      return parse(inputStream, file.getName());
    } catch (IOException e) {
      throw new ForceFieldException(format(" Force field file %s could not be parsed.", file), e);
    }
  }

  /**
   * Parse a force field document from a stream.
   *
   * @param inputStream the XML stream.
   * @param source      a description of the stream for messages.
   * @return the ForceField.
   * @throws ForceFieldException if the stream cannot be parsed or a record is malformed.
   */
  public static ForceField parse(InputStream inputStream, String source) {
    XMLStreamReader reader = null;
    try {
      reader = newInputFactory().createXMLStreamReader(inputStream);
      ForceField forceField = parse(reader);
      if (logger.isLoggable(Level.FINE)) {
        logger.fine(format(" Parsed force field %s from %s.\n%s", forceField.getName(), source,
            forceField));
      }
      return forceField;
    } catch (XMLStreamException e) {
      throw new ForceFieldException(format(" Force field %s could not be parsed.", source), e);
    } finally {
      if (reader != null) {
        try {
          reader.close();
        } catch (XMLStreamException e) {
          logger.log(Level.FINE, " Closing the XML reader failed.", e);
        }
      }
    }
  }

  /**
   * Collect the records of a document in a single pass.
   * <p>
   * The root element gives the force field attributes and its children the section attributes.
   * Type elements anywhere in the document are atom types, Atom children of NonbondedForce are
   * nonbonded records, and every element with an interaction kind's tag is a candidate record of
   * that kind.
   *
   * @param reader the stream reader, positioned before the root element.
   * @return the ForceField.
   * @throws XMLStreamException if the document is not well formed.
   */
  static ForceField parse(XMLStreamReader reader) throws XMLStreamException {
    ForceField forceField = new ForceField();
    Deque<String> path = new ArrayDeque<>();
    while (reader.hasNext()) {
      int event = reader.next();
      if (event == XMLStreamConstants.END_ELEMENT) {
        path.pop();
        continue;
      }
      if (event != XMLStreamConstants.START_ELEMENT) {
        continue;
      }

      String tag = reader.getLocalName();
      String parent = path.peek();
      int depth = path.size();
      path.push(tag);
      Map<String, String> attributes = getAttributes(reader);

      if (depth == 0) {
        forceField.setRootAttributes(attributes);
      } else if (depth == 1) {
        forceField.setSectionAttributes(tag, attributes);
      }

      if (ATOM.tag.equals(tag)) {
        forceField.addAtomType(AtomType.parse(attributes));
      } else if (NONBONDED.tag.equals(tag) && NONBONDED_FORCE.equals(parent)) {
        if (!attributes.containsKey(NonbondedType.TYPE)) {
          logger.warning(format(" Skipping %s record without a type: %s", NONBONDED_FORCE,
              attributes));
        } else {
          forceField.addNonbondedType(new NonbondedType(attributes));
        }
      } else {
        for (InteractionKind kind : InteractionKind.values()) {
          if (kind.getTag().equals(tag)) {
            forceField.addCandidate(kind, attributes);
            break;
          }
        }
      }
    }
    return forceField;
  }

  /**
   * The attributes of the current element, in document order.
   *
   * @param reader the stream reader, positioned on a start element.
   * @return attribute names mapped to values.
   */
  private static Map<String, String> getAttributes(XMLStreamReader reader) {
    Map<String, String> attributes = new LinkedHashMap<>();
    for (int i = 0; i < reader.getAttributeCount(); i++) {
      QName name = reader.getAttributeName(i);
      String prefix = name.getPrefix();
      String key = (prefix == null || prefix.isEmpty()) ? name.getLocalPart()
          : prefix + ":" + name.getLocalPart();
      attributes.put(key, reader.getAttributeValue(i));
    }
    return attributes;
  }

  private static XMLInputFactory newInputFactory() {
    XMLInputFactory factory = XMLInputFactory.newInstance();
    factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, Boolean.FALSE);
    factory.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
    factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
    return factory;
  }
}
