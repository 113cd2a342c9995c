/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.balancer.i18n;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * A {@link MessageFormatter} backed by the properties catalogs shipped with the balancer.  English is the root
 * catalog; Vietnamese is the only translation.  Keys missing from a translation fall back to English.
 */
public class LocalizedMessages implements MessageFormatter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(LocalizedMessages.class);

  public static final String BUNDLE_NAME = "com.twentyn.balancer.i18n.messages";
  public static final Locale VIETNAMESE = new Locale("vi");
  public static final List<Locale> SUPPORTED_LOCALES = Collections.unmodifiableList(Arrays.asList(
      Locale.ENGLISH, VIETNAMESE
  ));

  // Don't let the JVM's default locale leak in when English is requested.
  private static final ResourceBundle.Control NO_FALLBACK_CONTROL =
      ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES);

  private static final LocalizedMessages ENGLISH = new LocalizedMessages(Locale.ENGLISH);

  private final Locale locale;
  private final ResourceBundle bundle;

  public LocalizedMessages(Locale locale) {
    this.locale = locale;
    this.bundle = ResourceBundle.getBundle(BUNDLE_NAME, locale, NO_FALLBACK_CONTROL);
  }

  public static LocalizedMessages english() {
    return ENGLISH;
  }

  /**
   * Look up the catalog for a language tag such as "en" or "vi".
   * @throws IllegalArgumentException if the language has no catalog.
   */
  public static LocalizedMessages forLanguageTag(String languageTag) {
    Locale requested = Locale.forLanguageTag(languageTag);
    for (Locale supported : SUPPORTED_LOCALES) {
      if (supported.getLanguage().equals(requested.getLanguage())) {
        return supported.equals(Locale.ENGLISH) ? ENGLISH : new LocalizedMessages(supported);
      }
    }
    throw new IllegalArgumentException(String.format("Unsupported locale '%s', expected one of %s",
        languageTag, SUPPORTED_LOCALES));
  }

  public Locale getLocale() {
    return locale;
  }

  @Override
  public String format(MessageKey key, Object... args) {
    String pattern;
    try {
      pattern = bundle.getString(key.getKey());
    } catch (MissingResourceException e) {
      LOGGER.warn("No message for key %s in locale %s", key.getKey(), locale);
      return key.getKey();
    }
    return args.length == 0 ? pattern : String.format(locale, pattern, args);
  }
}
