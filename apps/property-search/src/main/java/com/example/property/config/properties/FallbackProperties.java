package com.example.property.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reference market data used to synthesize listings when no source returns anything.
 * City keys are slugs ("sao-paulo"); unknown cities use {@code defaultCity}.
 */
@ConfigurationProperties(prefix = "app.fallback")
public record FallbackProperties(
        Boolean deterministic,
        int minCount,
        int maxCount,
        String defaultCity,
        Map<String, CityReference> cities
) {
    public FallbackProperties {
        if (deterministic == null) {
            deterministic = Boolean.TRUE;
        }
        if (minCount <= 0) {
            minCount = 8;
        }
        if (maxCount < minCount) {
            maxCount = Math.max(minCount, 15);
        }
        if (cities == null || cities.isEmpty()) {
            cities = defaultCities();
        }
        if (defaultCity == null || defaultCity.isBlank() || !cities.containsKey(defaultCity)) {
            defaultCity = cities.containsKey("sao-paulo") ? "sao-paulo" : cities.keySet().iterator().next();
        }
    }

    public static FallbackProperties defaults() {
        return new FallbackProperties(true, 8, 15, "sao-paulo", defaultCities());
    }

    public CityReference referenceFor(String citySlug) {
        if (citySlug != null) {
            CityReference reference = cities.get(citySlug);
            if (reference != null) {
                return reference;
            }
        }
        return cities.get(defaultCity);
    }

    private static Map<String, CityReference> defaultCities() {
        Map<String, CityReference> cities = new LinkedHashMap<>();
        cities.put("sao-paulo", new CityReference("São Paulo", 650_000, 85,
                List.of("Vila Madalena", "Pinheiros", "Jardins")));
        cities.put("rio-de-janeiro", new CityReference("Rio de Janeiro", 580_000, 80,
                List.of("Copacabana", "Ipanema", "Leblon")));
        cities.put("brasilia", new CityReference("Brasília", 450_000, 90,
                List.of("Asa Sul", "Asa Norte", "Lago Sul")));
        cities.put("belo-horizonte", new CityReference("Belo Horizonte", 380_000, 85,
                List.of("Savassi", "Lourdes", "Funcionários")));
        cities.put("salvador", new CityReference("Salvador", 320_000, 80,
                List.of("Barra", "Ondina", "Campo Grande")));
        cities.put("fortaleza", new CityReference("Fortaleza", 280_000, 80,
                List.of("Meireles", "Aldeota", "Cocó")));
        return cities;
    }

    public record CityReference(String displayName, long basePrice, int baseSize, List<String> neighborhoods) {
        public CityReference {
            if (basePrice <= 0) {
                basePrice = 400_000;
            }
            if (baseSize <= 0) {
                baseSize = 80;
            }
            neighborhoods = neighborhoods == null || neighborhoods.isEmpty()
                    ? List.of("Centro")
                    : List.copyOf(neighborhoods);
        }
    }
}
