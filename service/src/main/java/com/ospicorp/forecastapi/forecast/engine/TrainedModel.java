package com.ospicorp.forecastapi.forecast.engine;

import com.ospicorp.forecastapi.forecast.model.ModelConfig;

public interface TrainedModel {

  ModelConfig config();
}
