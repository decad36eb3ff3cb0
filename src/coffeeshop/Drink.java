package coffeeshop;

import com.fasterxml.jackson.annotation.JsonAutoDetect;

import java.util.*;

@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.NON_PRIVATE)
public class Drink {
    long id;
    String title;
    List<Ingredient> recipe = new ArrayList<>();

    @JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.NON_PRIVATE)
    public static class Ingredient {
        String name;
        String color;
        int parts;

        public Ingredient() {
        }

        public Ingredient(String name, String color, int parts) {
            this.name = name;
            this.color = color;
            this.parts = parts;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Ingredient that = (Ingredient) o;
            return parts == that.parts && Objects.equals(name, that.name) && Objects.equals(color, that.color);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, color, parts);
        }
    }

    public Drink() {
    }

    public Drink(long id, String title, List<Ingredient> recipe) {
        this.id = id;
        this.title = title;
        this.recipe = recipe;
    }

    /**
     * Public representation: recipe ingredients without their names.
     */
    public Map<String, Object> toShort() {
        List<Map<String, Object>> ingredients = new ArrayList<>();
        for (Ingredient ingredient : recipe) {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("color", ingredient.color);
            map.put("parts", ingredient.parts);
            ingredients.add(map);
        }
        return representation(ingredients);
    }

    /**
     * Full representation, only shown to callers allowed to see drink details.
     */
    public Map<String, Object> toLong() {
        List<Map<String, Object>> ingredients = new ArrayList<>();
        for (Ingredient ingredient : recipe) {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("color", ingredient.color);
            map.put("name", ingredient.name);
            map.put("parts", ingredient.parts);
            ingredients.add(map);
        }
        return representation(ingredients);
    }

    private Map<String, Object> representation(List<Map<String, Object>> ingredients) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.put("title", title);
        map.put("recipe", ingredients);
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Drink drink = (Drink) o;
        return id == drink.id && Objects.equals(title, drink.title) && Objects.equals(recipe, drink.recipe);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, title, recipe);
    }

    @Override
    public String toString() {
        return "Drink{id=" + id + ", title='" + title + "'}";
    }
}
