package home.heating.service.impl;

import home.heating.configuration.HeatingConfiguration;
import home.heating.configuration.HeatingConfiguration.PinProperties;
import home.heating.exception.ActuatorException;
import home.heating.exception.ModbusException;
import home.heating.service.ModbusService;
import home.heating.service.RelayService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

/**
 * Пины на катушках релейного модуля modbus
 */
@Service
@Profile("!simulation")
public class ModbusRelayServiceImpl implements RelayService {
    private static final Logger logger = LoggerFactory.getLogger(ModbusRelayServiceImpl.class);
    private final HeatingConfiguration configuration;
    private final ModbusService modbusService;

    public ModbusRelayServiceImpl(HeatingConfiguration configuration, ModbusService modbusService) {
        this.configuration = configuration;
        this.modbusService = modbusService;
    }

    @Override
    public boolean readState(String pin) throws ActuatorException {
        PinProperties properties = getProperties(pin);
        try {
            boolean coil = modbusService.readCoil(properties.getAddress(), properties.getCoil());
            return coil != properties.isInverted();
        } catch (ModbusException e) {
            logger.error("{} - ошибка опроса реле, адрес {}, катушка {}", pin, properties.getAddress(),
                properties.getCoil());
            throw new ActuatorException(pin, "Ошибка опроса реле " + pin, e);
        }
    }

    @Override
    public void writeState(String pin, boolean on) throws ActuatorException {
        PinProperties properties = getProperties(pin);
        try {
            modbusService.writeCoil(properties.getAddress(), properties.getCoil(), on != properties.isInverted());
        } catch (ModbusException e) {
            logger.error("{} - ошибка записи реле, адрес {}, катушка {}", pin, properties.getAddress(),
                properties.getCoil());
            throw new ActuatorException(pin, "Ошибка записи реле " + pin, e);
        }
    }

    private PinProperties getProperties(String pin) throws ActuatorException {
        PinProperties properties = configuration.getPins().get(pin);
        if (properties == null || properties.getAddress() == null || properties.getCoil() == null) {
            throw new ActuatorException(pin, "Для пина " + pin + " не настроены адрес и катушка");
        }
        return properties;
    }
}
