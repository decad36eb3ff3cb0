package coffeeshop;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import coffeeshop.auth.Authorizer;
import coffeeshop.auth.Claims;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;
import java.util.logging.Logger;

import static coffeeshop.Json.JSON_MAPPER;
import static coffeeshop.Web.*;
import static coffeeshop.Web.Method.*;

class Webapp implements Web.Handler {
    private static final Logger log = Logger.getLogger(Webapp.class.getName());

    static final String GET_DRINKS_DETAIL = "get:drinks-detail";
    static final String POST_DRINKS = "post:drinks";
    static final String PATCH_DRINKS = "patch:drinks";
    static final String DELETE_DRINKS = "delete:drinks";

    private final DataStore dataStore;
    private final Web.Router router;

    Webapp(DataStore dataStore, Authorizer authorizer) {
        this.dataStore = dataStore;

        router = new Router(authorizer);
        router.on(GET, "/drinks", this::listDrinks);
        router.on(GET, "/drinks-detail", this::listDrinksDetail, GET_DRINKS_DETAIL);
        router.on(POST, "/drinks", this::createDrink, POST_DRINKS);
        router.on(PATCH, "/drinks/<id:[0-9]+>", this::updateDrink, PATCH_DRINKS);
        router.on(DELETE, "/drinks/<id:[0-9]+>", this::deleteDrink, DELETE_DRINKS);
    }

    Response listDrinks(Web.Request request) throws IOException {
        List<Map<String, Object>> drinks = new ArrayList<>();
        for (Drink drink : dataStore.list()) {
            drinks.add(drink.toShort());
        }
        return success("drinks", drinks);
    }

    Response listDrinksDetail(Web.Request request, Claims claims) throws IOException {
        List<Map<String, Object>> drinks = new ArrayList<>();
        for (Drink drink : dataStore.list()) {
            drinks.add(drink.toLong());
        }
        return success("drinks", drinks);
    }

    Response createDrink(Web.Request request, Claims claims) throws IOException, ResponseException {
        JsonNode body = readBody(request);
        if (!body.isObject() || !body.hasNonNull("title") || !body.hasNonNull("recipe")) {
            throw new ResponseException(unprocessable());
        }
        String title = parseTitle(body.get("title"));
        List<Drink.Ingredient> recipe = parseRecipe(body.get("recipe"));
        try {
            Drink drink = dataStore.insert(title, recipe);
            log.info(claims.subject() + " created " + drink);
            return success("drinks", Collections.singletonList(drink.toLong()));
        } catch (DuplicateTitleException e) {
            throw new ResponseException(badRequest());
        }
    }

    Response updateDrink(Web.Request request, Claims claims) throws IOException, ResponseException {
        long id = parseId(request);
        if (dataStore.get(id) == null) {
            return notFound();
        }
        JsonNode body = readBody(request);
        if (!body.isObject()) {
            throw new ResponseException(unprocessable());
        }
        String title = body.hasNonNull("title") ? parseTitle(body.get("title")) : null;
        List<Drink.Ingredient> recipe = body.hasNonNull("recipe") ? parseRecipe(body.get("recipe")) : null;
        try {
            Drink drink = dataStore.update(id, title, recipe);
            if (drink == null) {
                return notFound();
            }
            log.info(claims.subject() + " updated " + drink);
            return success("drinks", Collections.singletonList(drink.toLong()));
        } catch (DuplicateTitleException e) {
            throw new ResponseException(badRequest());
        }
    }

    Response deleteDrink(Web.Request request, Claims claims) throws IOException, ResponseException {
        long id = parseId(request);
        if (!dataStore.delete(id)) {
            return notFound();
        }
        log.info(claims.subject() + " deleted drink " + id);
        return success("delete", id);
    }

    private static Response success(String key, Object value) throws JsonProcessingException {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("success", true);
        map.put(key, value);
        return jsonResponse(map);
    }

    private static long parseId(Web.Request request) throws ResponseException {
        try {
            return Long.parseLong(request.param("id"));
        } catch (NumberFormatException e) {
            throw new ResponseException(notFound());
        }
    }

    private static JsonNode readBody(Web.Request request) throws ResponseException {
        try (InputStream stream = request.inputStream()) {
            JsonNode node = stream == null ? null : JSON_MAPPER.readTree(stream);
            if (node == null || node.isMissingNode()) {
                throw new ResponseException(badRequest());
            }
            return node;
        } catch (IOException e) {
            throw new ResponseException(badRequest());
        }
    }

    private static String parseTitle(JsonNode node) throws ResponseException {
        if (!node.isTextual() || node.asText().isBlank()) {
            throw new ResponseException(unprocessable());
        }
        return node.asText();
    }

    /**
     * Accepts either a single ingredient object or an array of them.
     */
    static List<Drink.Ingredient> parseRecipe(JsonNode node) throws ResponseException {
        List<JsonNode> items = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(items::add);
        } else if (node.isObject()) {
            items.add(node);
        } else {
            throw new ResponseException(unprocessable());
        }
        if (items.isEmpty()) {
            throw new ResponseException(unprocessable());
        }

        List<Drink.Ingredient> recipe = new ArrayList<>();
        for (JsonNode item : items) {
            if (!item.isObject() || !item.path("name").isTextual() || !item.path("color").isTextual()
                    || !item.path("parts").isIntegralNumber() || !item.path("parts").canConvertToInt()
                    || item.path("parts").asInt() <= 0) {
                throw new ResponseException(unprocessable());
            }
            recipe.add(new Drink.Ingredient(item.get("name").asText(), item.get("color").asText(),
                    item.get("parts").asInt()));
        }
        return recipe;
    }

    @Override
    public Response handle(Web.Request request) throws Exception {
        return router.handle(request);
    }
}
