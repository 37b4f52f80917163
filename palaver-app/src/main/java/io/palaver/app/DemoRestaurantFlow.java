package io.palaver.app;

import io.palaver.core.flow.ConversationApp;
import io.palaver.core.flow.Flow;
import io.palaver.core.prompt.InputSpec;
import io.palaver.core.signal.Media;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Sample ordering conversation that runs unchanged on text and interactive channels.
 */
public final class DemoRestaurantFlow extends Flow {
    static final Map<String, String> CATEGORIES = categories();
    private static final Map<String, String> CONFIRMATION = confirmation();
    private static final Map<String, List<String>> DISHES = Map.of(
        "starters", List.of("Spring Rolls", "Garlic Bread", "Chicken Wings"),
        "mains", List.of("Jollof Rice", "Grilled Tilapia", "Beef Suya", "Vegetable Curry"),
        "desserts", List.of("Chocolate Cake", "Fruit Salad"),
        "drinks", List.of("Sobolo", "Fresh Orange Juice", "Water")
    );

    public DemoRestaurantFlow(ConversationApp app) {
        super(app);
    }

    public void main() {
        String name = app.screen("customer_name", prompt -> prompt.ask(
            "Welcome to Palaver Restaurant! What's your name?",
            InputSpec.text()
                .validate(value -> value.trim().length() < 2 ? "Name must be at least 2 characters" : null)
                .transform(DemoRestaurantFlow::titleCase)
        ));

        String category = app.screen("menu_category", prompt -> prompt.select(
            "Hi " + name + "! Choose a category:",
            CATEGORIES
        ));

        List<String> dishes = DISHES.get(category);
        String dish = app.screen("dish", prompt -> prompt.select("Choose a dish:", dishes));

        int quantity = app.screen("quantity", prompt -> prompt.ask(
            "How many " + dish + "?",
            InputSpec.integer().validate(value -> value < 1 || value > 20 ? "Enter a quantity between 1 and 20" : null)
        ));

        String decision = app.screen("confirm", prompt -> prompt.select(
            "Order " + quantity + " x " + dish + " for " + name + "?",
            CONFIRMATION
        ));
        if ("change".equals(decision)) {
            app.session().delete("quantity");
            app.goBack();
        }
        if ("cancel".equals(decision)) {
            app.say("Order cancelled. Dial again any time.");
        }
        app.say(
            "Thank you " + name + "! Your order of " + quantity + " x " + dish + " is on its way.",
            Media.image("https://palaver.example/receipt.png")
        );
    }

    private static Map<String, String> categories() {
        Map<String, String> categories = new LinkedHashMap<>();
        categories.put("starters", "Starters");
        categories.put("mains", "Main Courses");
        categories.put("desserts", "Desserts");
        categories.put("drinks", "Drinks");
        return categories;
    }

    private static Map<String, String> confirmation() {
        Map<String, String> choices = new LinkedHashMap<>();
        choices.put("confirm", "Confirm");
        choices.put("change", "Change quantity");
        choices.put("cancel", "Cancel");
        return choices;
    }

    static String titleCase(String raw) {
        String[] words = raw.trim().split("\\s+");
        StringBuilder result = new StringBuilder();
        for (String word : words) {
            if (result.length() > 0) {
                result.append(' ');
            }
            result.append(word.substring(0, 1).toUpperCase(Locale.ROOT)).append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return result.toString();
    }
}
