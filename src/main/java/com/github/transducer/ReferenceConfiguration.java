package com.github.transducer;

import com.github.transducer.TransducerConfiguration.TransducerConfigurationBuilder;

/**
 * The reference data set: states and transitions recognizing person names, dates, emails, phone
 * numbers, addresses, prices and URLs in (mostly Hungarian flavoured) free text.
 *
 * Transition order is match priority. Note that a bare four digit token is claimed by the number
 * transition before the postal code transition gets a chance, so the address path is only reached
 * through configurations that declare it earlier.
 */
public final class ReferenceConfiguration {
  public static final String INITIAL_STATE = "q0";

  public static final String PERSON = "PERSON";
  public static final String DATE = "DATE";
  public static final String EMAIL = "EMAIL";
  public static final String PHONE_NUMBER = "PHONE_NUMBER";
  public static final String URL = "URL";
  public static final String PRICE = "PRICE";
  public static final String POSTALCODE = "POSTALCODE";
  public static final String CITY = "CITY";
  public static final String ADDRESS = "ADDRESS";

  private static final String capitalizedWord = "\\p{Lu}\\p{Ll}+";

  /**
   * A builder preloaded with the reference data. Callers may add states and transitions before
   * building it.
   */
  public static TransducerConfigurationBuilder newBuilder() {
    return TransducerConfigurationBuilder.newBuilder().initialState(INITIAL_STATE)
        .addState("q0", false)
        .addState("q1_person", false)
        .addState("q_date", true)
        .addState("q2_person", true)
        .addState("q_email", true)
        .addState("q_phone", true)
        .addState("q_url", true)
        .addState("q_number", false)
        .addState("q_currency", true)
        .addState("q_postalcode", false)
        .addState("q_city", false)
        .addState("q_street", false)
        .addState("q_street_type", false)
        .addState("q_address", true)
        // phone numbers
        .addTransition("q0", "(06|\\+36)\\d{2}[\\s\\-]?\\d{3}[\\s\\-]?\\d{4}", "q_phone",
            PHONE_NUMBER)
        // numbers, then a currency
        .addTransition("q0", "\\d+", "q_number")
        .addTransition("q_number", "\\s?(forint|HUF|EUR|USD|dollars|euros|yen|pounds|GBP)",
            "q_currency", PRICE)
        // postal code, city, street, street type, house number
        .addTransition("q0", "\\d{4},?", "q_postalcode", POSTALCODE)
        .addTransition("q_postalcode", capitalizedWord + "(?: \\p{L}+)*,?", "q_city", CITY)
        .addTransition("q_city", "[\\p{L}\\s]+", "q_street", ADDRESS)
        .addTransition("q_street", "(utca|tér|út|körút)", "q_street_type", ADDRESS)
        .addTransition("q_street_type", "\\d+", "q_address", ADDRESS)
        // first name, optional middle names, last name
        .addTransition("q0", capitalizedWord, "q1_person")
        .addTransition("q1_person", capitalizedWord, "q1_person", PERSON)
        .addTransition("q1_person", capitalizedWord, "q2_person", PERSON)
        .addTransition("q0", "[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}", "q_email", EMAIL)
        // yyyy-mm-dd, dd.mm.yyyy and mm/dd/yyyy
        .addTransition("q0",
            "(\\d{4}[.\\-]?\\d{2}[.\\-]?\\d{2}|\\d{2}[.\\-]?\\d{2}[.\\-]?\\d{4}|\\d{2}/\\d{2}/\\d{4})",
            "q_date", DATE)
        .addTransition("q0", "https?://[A-Za-z0-9.-]+(?:/[A-Za-z0-9&%_./-]*)?", "q_url", URL);
  }

  public static TransducerConfiguration create() throws TransducerException {
    return newBuilder().build();
  }

  private ReferenceConfiguration() {}
}
