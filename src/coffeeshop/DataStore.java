package coffeeshop;

import org.rocksdb.*;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.*;
import java.util.logging.Logger;

import static coffeeshop.Json.JSON_MAPPER;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Stores drinks in RocksDB.
 * <p>
 * Drinks are kept as JSON in the "drinks" column family keyed by big-endian id,
 * so iteration returns them in id order. The "titles" column family maps each
 * title to its drink id and enforces uniqueness. The next id to assign lives
 * in the default column family.
 */
public class DataStore implements Closeable {
    private static final Logger log = Logger.getLogger(DataStore.class.getName());
    private static final byte[] NEXT_ID_KEY = "next-id".getBytes(UTF_8);

    static {
        RocksDB.loadLibrary();
    }

    private final RocksDB db;
    private final DBOptions dbOptions;
    private final ColumnFamilyOptions cfOptions;
    private final List<ColumnFamilyHandle> cfHandles = new ArrayList<>();
    private final ColumnFamilyHandle defaultCF;
    private final ColumnFamilyHandle drinksCF;
    private final ColumnFamilyHandle titlesCF;
    private final Object writeLock = new Object();

    public DataStore(File dataDir) throws IOException {
        if (!dataDir.isDirectory() && !dataDir.mkdirs()) {
            throw new IOException("Unable to create data directory " + dataDir);
        }
        dbOptions = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        cfOptions = new ColumnFamilyOptions()
                .setCompressionType(CompressionType.SNAPPY_COMPRESSION);
        List<ColumnFamilyDescriptor> cfDescriptors = Arrays.asList(
                new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, cfOptions),
                new ColumnFamilyDescriptor("drinks".getBytes(UTF_8), cfOptions),
                new ColumnFamilyDescriptor("titles".getBytes(UTF_8), cfOptions));
        try {
            db = RocksDB.open(dbOptions, dataDir.getPath(), cfDescriptors, cfHandles);
        } catch (RocksDBException e) {
            throw new IOException("Unable to open drinks database in " + dataDir, e);
        }
        defaultCF = cfHandles.get(0);
        drinksCF = cfHandles.get(1);
        titlesCF = cfHandles.get(2);
    }

    /**
     * All drinks, ordered by id.
     */
    public List<Drink> list() throws IOException {
        List<Drink> drinks = new ArrayList<>();
        try (RocksIterator it = db.newIterator(drinksCF)) {
            for (it.seekToFirst(); it.isValid(); it.next()) {
                drinks.add(decode(it.value()));
            }
        }
        return drinks;
    }

    /**
     * Returns the drink with the given id, or null if there isn't one.
     */
    public Drink get(long id) throws IOException {
        try {
            byte[] value = db.get(drinksCF, encodeId(id));
            return value == null ? null : decode(value);
        } catch (RocksDBException e) {
            throw new IOException(e);
        }
    }

    public Drink insert(String title, List<Drink.Ingredient> recipe) throws IOException, DuplicateTitleException {
        synchronized (writeLock) {
            try {
                checkTitleAvailable(title, null);
                long id = nextId();
                Drink drink = new Drink(id, title, recipe);
                try (WriteBatch batch = new WriteBatch(); WriteOptions writeOptions = new WriteOptions()) {
                    batch.put(defaultCF, NEXT_ID_KEY, encodeId(id + 1));
                    batch.put(drinksCF, encodeId(id), encode(drink));
                    batch.put(titlesCF, title.getBytes(UTF_8), encodeId(id));
                    db.write(writeOptions, batch);
                }
                log.fine("Inserted " + drink);
                return drink;
            } catch (RocksDBException e) {
                throw new IOException(e);
            }
        }
    }

    /**
     * Replaces the title and/or recipe of an existing drink. Null arguments leave
     * that field unchanged.
     *
     * @return the updated drink, or null if no drink has that id
     */
    public Drink update(long id, String title, List<Drink.Ingredient> recipe) throws IOException, DuplicateTitleException {
        synchronized (writeLock) {
            try {
                Drink drink = get(id);
                if (drink == null) {
                    return null;
                }
                String oldTitle = drink.title;
                if (title != null) {
                    checkTitleAvailable(title, id);
                    drink.title = title;
                }
                if (recipe != null) {
                    drink.recipe = recipe;
                }
                try (WriteBatch batch = new WriteBatch(); WriteOptions writeOptions = new WriteOptions()) {
                    if (!oldTitle.equals(drink.title)) {
                        batch.delete(titlesCF, oldTitle.getBytes(UTF_8));
                        batch.put(titlesCF, drink.title.getBytes(UTF_8), encodeId(id));
                    }
                    batch.put(drinksCF, encodeId(id), encode(drink));
                    db.write(writeOptions, batch);
                }
                log.fine("Updated " + drink);
                return drink;
            } catch (RocksDBException e) {
                throw new IOException(e);
            }
        }
    }

    /**
     * @return true if a drink was deleted, false if there was no drink with that id
     */
    public boolean delete(long id) throws IOException {
        synchronized (writeLock) {
            try {
                Drink drink = get(id);
                if (drink == null) {
                    return false;
                }
                try (WriteBatch batch = new WriteBatch(); WriteOptions writeOptions = new WriteOptions()) {
                    batch.delete(drinksCF, encodeId(id));
                    batch.delete(titlesCF, drink.title.getBytes(UTF_8));
                    db.write(writeOptions, batch);
                }
                log.fine("Deleted " + drink);
                return true;
            } catch (RocksDBException e) {
                throw new IOException(e);
            }
        }
    }

    /**
     * Drops every drink, restarts ids from 1 and seeds the store with a glass of water.
     */
    public void reset() throws IOException {
        synchronized (writeLock) {
            try (WriteBatch batch = new WriteBatch(); WriteOptions writeOptions = new WriteOptions()) {
                for (ColumnFamilyHandle cf : Arrays.asList(drinksCF, titlesCF)) {
                    try (RocksIterator it = db.newIterator(cf)) {
                        for (it.seekToFirst(); it.isValid(); it.next()) {
                            batch.delete(cf, it.key());
                        }
                    }
                }
                batch.delete(defaultCF, NEXT_ID_KEY);
                db.write(writeOptions, batch);
            } catch (RocksDBException e) {
                throw new IOException(e);
            }
            try {
                insert("water", Collections.singletonList(new Drink.Ingredient("water", "blue", 1)));
            } catch (DuplicateTitleException e) {
                throw new IllegalStateException("store not empty after reset", e);
            }
        }
    }

    private void checkTitleAvailable(String title, Long ownId) throws RocksDBException, DuplicateTitleException {
        byte[] existing = db.get(titlesCF, title.getBytes(UTF_8));
        if (existing != null && (ownId == null || decodeId(existing) != ownId)) {
            throw new DuplicateTitleException(title);
        }
    }

    private long nextId() throws RocksDBException {
        byte[] value = db.get(defaultCF, NEXT_ID_KEY);
        return value == null ? 1 : decodeId(value);
    }

    static byte[] encodeId(long id) {
        return ByteBuffer.allocate(Long.BYTES).putLong(id).array();
    }

    static long decodeId(byte[] bytes) {
        return ByteBuffer.wrap(bytes).getLong();
    }

    private static byte[] encode(Drink drink) throws IOException {
        return JSON_MAPPER.writeValueAsBytes(drink);
    }

    private static Drink decode(byte[] bytes) throws IOException {
        return JSON_MAPPER.readValue(bytes, Drink.class);
    }

    @Override
    public void close() {
        for (ColumnFamilyHandle handle : cfHandles) {
            handle.close();
        }
        db.close();
        dbOptions.close();
        cfOptions.close();
    }
}
