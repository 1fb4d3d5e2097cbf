package com.energyforecast.exception;

/**
 * 网格搜索中所有候选配置都训练失败
 */
public class NoViableConfigurationException extends ForecastException {
    public NoViableConfigurationException(String message) {
        super("NO_VIABLE_CONFIGURATION", message);
    }
}
