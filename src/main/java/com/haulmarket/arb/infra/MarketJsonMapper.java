package com.haulmarket.arb.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.haulmarket.arb.domain.ItemInfo;
import com.haulmarket.arb.domain.MarketOrder;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class MarketJsonMapper {

    private final ObjectMapper objectMapper;

    public MarketJsonMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<MarketOrder> parseOrders(String json, long marketId) throws JsonProcessingException {
        return parseOrders(objectMapper.readTree(json), marketId);
    }

    public List<MarketOrder> parseOrders(JsonNode ordersNode, long marketId) {
        if (ordersNode == null || !ordersNode.isArray()) {
            return Collections.emptyList();
        }
        List<MarketOrder> orders = new ArrayList<>(ordersNode.size());
        for (JsonNode o : ordersNode) {
            orders.add(MarketOrder.builder()
                    .orderId(o.path("order_id").asLong())
                    .itemId(o.path("type_id").asLong())
                    .price(new BigDecimal(o.path("price").asText("0")))
                    .volumeRemain(o.path("volume_remain").asLong())
                    .side(o.path("is_buy_order").asBoolean(false) ? MarketOrder.Side.BUY : MarketOrder.Side.SELL)
                    .marketId(marketId)
                    .locationId(o.path("location_id").asLong())
                    .build());
        }
        return orders;
    }

    /**
     * Name comes from {@code name}; bulk prefers {@code packaged_volume}, then {@code volume}.
     */
    public ItemInfo parseItem(long itemId, JsonNode node) {
        String name = node.path("name").asText("");
        if (name.isEmpty()) {
            name = "Item " + itemId;
        }
        BigDecimal bulk = ItemInfo.DEFAULT_BULK;
        if (node.hasNonNull("packaged_volume")) {
            bulk = new BigDecimal(node.get("packaged_volume").asText());
        } else if (node.hasNonNull("volume")) {
            bulk = new BigDecimal(node.get("volume").asText());
        }
        return ItemInfo.builder()
                .itemId(itemId)
                .name(name)
                .bulk(bulk)
                .placeholder(false)
                .build();
    }

    public List<Long> parseSearchHits(JsonNode node, String category, int limit) {
        List<Long> ids = new ArrayList<>();
        for (JsonNode id : node.path(category)) {
            if (ids.size() >= limit) {
                break;
            }
            ids.add(id.asLong());
        }
        return ids;
    }

    public Map<Long, BigDecimal> parseAdjustedPrices(JsonNode node) {
        Map<Long, BigDecimal> prices = new LinkedHashMap<>();
        for (JsonNode entry : node) {
            prices.put(entry.path("type_id").asLong(),
                    new BigDecimal(entry.path("adjusted_price").asText("0")));
        }
        return prices;
    }
}
