package com.tradescan.backend.service.scanner;

import com.tradescan.backend.config.ScannerProperties;
import com.tradescan.backend.exception.BadRequestException;
import com.tradescan.backend.model.params.OptionParameters;
import com.tradescan.backend.model.params.StockParameters;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

@Service
@RequiredArgsConstructor
public class InstrumentUniverseResolver {

    private final ScannerProperties scannerProperties;

    public List<String> resolve(StockParameters parameters) {
        List<String> symbols = normalize(parameters.getSymbols());
        if (symbols.isEmpty()) {
            symbols = normalize(scannerProperties.getDefaultUniverse());
        }
        if (symbols.isEmpty()) {
            throw new BadRequestException("Universe is empty or not configured");
        }
        return symbols;
    }

    public List<String> resolve(OptionParameters parameters) {
        List<String> underlyings = normalize(parameters.getUnderlyings());
        if (underlyings.isEmpty()) {
            throw new BadRequestException("Option profile has no underlyings");
        }
        return underlyings;
    }

    private List<String> normalize(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(Objects::nonNull)
                .map(value -> value.trim().toUpperCase())
                .filter(value -> !value.isBlank())
                .distinct()
                .sorted()
                .toList();
    }
}
