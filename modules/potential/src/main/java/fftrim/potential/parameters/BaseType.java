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
package fftrim.potential.parameters;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import fftrim.potential.parameters.ForceField.ForceFieldType;

/**
 * All force field types should extend the BaseType class.
 * <p>
 * A type keeps the attributes of the record it was read from exactly as they appeared, in document
 * order, so that it can be written back out unchanged.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public abstract class BaseType {

  private static final Logger logger = Logger.getLogger(BaseType.class.getName());

  /**
   * The ForceFieldType of this term.
   */
  final ForceFieldType forceFieldType;
  /**
   * The look-up key for this term: an atom type name, or a concatenation of constraint values.
   */
  protected final String key;
  /**
   * The raw attributes of the record, in document order.
   */
  private final Map<String, String> attributes;

  /**
   * Public constructor.
   *
   * @param forceFieldType a {@link ForceFieldType} object.
   * @param key            the look-up key.
   * @param attributes     the raw attributes of the record.
   * @since 1.0
   */
  public BaseType(ForceFieldType forceFieldType, String key, Map<String, String> attributes) {
    this.forceFieldType = forceFieldType;
    this.key = key;
    this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  /**
   * Get the <code>key</code> for this Type.
   *
   * @return the key
   * @since 1.0
   */
  public String getKey() {
    return key;
  }

  /**
   * Get the ForceFieldType of this Type.
   *
   * @return the ForceFieldType.
   */
  public ForceFieldType getForceFieldType() {
    return forceFieldType;
  }

  /**
   * The raw attributes of the record this type was read from, in document order.
   *
   * @return an unmodifiable view of the attributes.
   */
  public Map<String, String> getAttributes() {
    return attributes;
  }

  /**
   * Look up one raw attribute.
   *
   * @param name the attribute name.
   * @return the value, or null if the record does not define it.
   */
  public String getAttribute(String name) {
    return attributes.get(name);
  }

  /**
   * Log <code>this</code> type.
   *
   * @since 1.0
   */
  public void log() {
    if (logger.isLoggable(Level.INFO)) {
      logger.info(toString());
    }
  }

  /**
   * {@inheritDoc}
   * <p>
   * Basic toString method.
   *
   * @since 1.0
   */
  @Override
  public String toString() {
    return forceFieldType + " " + key + " " + attributes;
  }
}
