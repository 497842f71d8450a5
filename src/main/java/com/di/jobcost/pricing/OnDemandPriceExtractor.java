package com.di.jobcost.pricing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Iterator;

/**
 * Pulls the on-demand hourly USD price out of one pricing-catalog product document.
 *
 * <p>Walks {@code terms.OnDemand.<offer>.priceDimensions.<rate>} in document order and returns
 * {@code pricePerUnit.USD} of the first dimension whose {@code unit} is {@code Hrs}. Other units
 * (e.g. {@code GB-Mo}) are skipped.
 */
@Component
public class OnDemandPriceExtractor {

    static final String HOURLY_UNIT = "Hrs";

    private final ObjectMapper objectMapper;

    public OnDemandPriceExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws PriceExtractionException if the document is not JSON or carries no hourly USD price
     */
    public double extractHourlyUsd(String productJson) {
        JsonNode root;
        try {
            root = objectMapper.readTree(productJson);
        } catch (JsonProcessingException e) {
            throw new PriceExtractionException("Product document is not valid JSON", e);
        }
        if (root == null) {
            throw new PriceExtractionException("Product document is empty");
        }
        JsonNode onDemand = root.path("terms").path("OnDemand");
        for (Iterator<JsonNode> offers = onDemand.elements(); offers.hasNext(); ) {
            JsonNode dimensions = offers.next().path("priceDimensions");
            for (Iterator<JsonNode> it = dimensions.elements(); it.hasNext(); ) {
                JsonNode dimension = it.next();
                if (!HOURLY_UNIT.equals(dimension.path("unit").asText())) {
                    continue;
                }
                JsonNode usd = dimension.path("pricePerUnit").path("USD");
                if (usd.isMissingNode() || usd.isNull()) {
                    continue;
                }
                return parsePrice(usd.asText());
            }
        }
        throw new PriceExtractionException("Price with unit '" + HOURLY_UNIT + "' not found in product document");
    }

    private static double parsePrice(String raw) {
        try {
            double price = Double.parseDouble(raw);
            if (!Double.isFinite(price) || price < 0) {
                throw new PriceExtractionException("Hourly price is not a non-negative number: " + raw);
            }
            return price;
        } catch (NumberFormatException e) {
            throw new PriceExtractionException("Hourly price is not numeric: " + raw, e);
        }
    }
}
