/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.provider;

/**
 * Source of domain-flavored values. Supplied by the caller so tests can substitute a
 * deterministic implementation; each method returns one fresh value per call.
 */
public interface RealisticValueProvider {

  String name();

  String city();

  String phone();

  /** A single free-form word, used to invent new category labels. */
  String word();

  String email();
}
