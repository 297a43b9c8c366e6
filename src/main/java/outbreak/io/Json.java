package outbreak.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/** Shared Gson instance; dates travel as ISO {@code yyyy-MM-dd} strings. */
public final class Json {

    public static final Gson GSON = new GsonBuilder()
        .registerTypeAdapter(LocalDate.class, new LocalDateAdapter().nullSafe())
        .create();

    private Json() { }

    static final class LocalDateAdapter extends TypeAdapter<LocalDate> {

        @Override
        public void write(JsonWriter out, LocalDate value) throws IOException {
            out.value(value.toString());
        }

        @Override
        public LocalDate read(JsonReader in) throws IOException {
            if (in.peek() != JsonToken.STRING) {
                throw new IOException("Expected ISO date string at " + in.getPath());
            }
            String text = in.nextString();
            try {
                return LocalDate.parse(text.trim());
            } catch (DateTimeParseException e) {
                throw new IOException("Invalid date '" + text + "' at " + in.getPath(), e);
            }
        }
    }
}
