package dev.blueprint.exception;

public class UnitNotRegisteredException extends PipelineConfigurationException {

    private final String unitName;

    public UnitNotRegisteredException(String unitName) {
        super("Unit not registered: " + unitName);
        this.unitName = unitName;
    }

    public String getUnitName() {
        return unitName;
    }
}
