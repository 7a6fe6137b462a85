/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.provider;

import com.luisppb16.synthseed.config.GenerationConfig;
import java.util.Locale;
import java.util.Objects;
import java.util.Random;
import net.datafaker.Faker;

/** {@link RealisticValueProvider} backed by Datafaker. */
public final class FakerValueProvider implements RealisticValueProvider {

  private final Faker faker;

  public FakerValueProvider(final Faker faker) {
    this.faker = Objects.requireNonNull(faker, "Faker cannot be null");
  }

  public FakerValueProvider(final Locale locale, final Random random) {
    this(new Faker(locale, random));
  }

  public static FakerValueProvider from(final GenerationConfig config) {
    return new FakerValueProvider(config.locale(), config.newRandom());
  }

  @Override
  public String name() {
    return faker.name().fullName();
  }

  @Override
  public String city() {
    return faker.address().city();
  }

  @Override
  public String phone() {
    return faker.phoneNumber().phoneNumber();
  }

  @Override
  public String word() {
    return faker.lorem().word();
  }

  @Override
  public String email() {
    return faker.internet().emailAddress();
  }
}
