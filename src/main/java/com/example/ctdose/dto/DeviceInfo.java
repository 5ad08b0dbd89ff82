package com.example.ctdose.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * 设备观察者信息（Device Observer）
 */
public final class DeviceInfo {

    @JsonProperty("observer_name")
    private final String observerName;

    @JsonProperty("manufacturer")
    private final String manufacturer;

    @JsonProperty("model_name")
    private final String modelName;

    @JsonProperty("serial_number")
    private final String serialNumber;

    @JsonProperty("physical_location")
    private final String physicalLocation;

    @JsonCreator
    public DeviceInfo(@JsonProperty("observer_name") String observerName,
                      @JsonProperty("manufacturer") String manufacturer,
                      @JsonProperty("model_name") String modelName,
                      @JsonProperty("serial_number") String serialNumber,
                      @JsonProperty("physical_location") String physicalLocation) {
        this.observerName = observerName;
        this.manufacturer = manufacturer;
        this.modelName = modelName;
        this.serialNumber = serialNumber;
        this.physicalLocation = physicalLocation;
    }

    public static DeviceInfo empty() {
        return new DeviceInfo(null, null, null, null, null);
    }

    public String getObserverName() { return observerName; }

    public String getManufacturer() { return manufacturer; }

    public String getModelName() { return modelName; }

    public String getSerialNumber() { return serialNumber; }

    public String getPhysicalLocation() { return physicalLocation; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeviceInfo)) return false;
        DeviceInfo that = (DeviceInfo) o;
        return Objects.equals(observerName, that.observerName)
                && Objects.equals(manufacturer, that.manufacturer)
                && Objects.equals(modelName, that.modelName)
                && Objects.equals(serialNumber, that.serialNumber)
                && Objects.equals(physicalLocation, that.physicalLocation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(observerName, manufacturer, modelName, serialNumber, physicalLocation);
    }
}
