package com.ospicorp.forecastapi.forecast.model;

public enum Growth {
  LINEAR,
  FLAT
}
