// file: server/src/main/java/io/graphvault/server/graph/Neo4jGraphStore.java
package io.graphvault.server.graph;

import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Record;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.exceptions.AuthenticationException;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.neo4j.driver.summary.SummaryCounters;

import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link GraphStore} backed by the Neo4j Java driver.
 * <p>
 * One driver per process, one short-lived session per statement. Writes run in
 * managed transactions ({@code executeWrite}) so the driver retries transient
 * failures itself; what still escapes is mapped onto our exception types:
 *  - ServiceUnavailable / SessionExpired -> {@link StoreConnectionException}
 *  - any other Neo4jException            -> {@link GraphQueryException}
 */
public final class Neo4jGraphStore implements GraphStore, AutoCloseable {
    private static final Logger log = Logger.getLogger(Neo4jGraphStore.class.getName());

    private final String uri;
    private final String user;
    private final String password;

    // requests run on Undertow worker threads, several at a time
    private volatile Driver driver; // null until connect() succeeds
    private volatile boolean connected;

    public Neo4jGraphStore(String uri, String user, String password) {
        this.uri = uri;
        this.user = user;
        this.password = password;
    }

    @Override
    public synchronized boolean connect() {
        close();
        Driver candidate = GraphDatabase.driver(uri, AuthTokens.basic(user, password == null ? "" : password));
        try {
            candidate.verifyConnectivity();
            driver = candidate;
            connected = true;
            log.info("Connected to graph store at " + uri);
            return true;
        } catch (ServiceUnavailableException | AuthenticationException e) {
            log.log(Level.WARNING, "Graph store at " + uri + " is not reachable: " + e.getMessage());
            candidate.close();
            return false;
        }
    }

    @Override
    public boolean isConnected() {
        return connected && driver != null;
    }

    @Override
    public List<Map<String, Object>> executeQuery(String query, Map<String, Object> params) {
        Driver d = requireDriver();
        try (Session session = d.session()) {
            return session.run(query, params).list(Record::asMap);
        } catch (ServiceUnavailableException | SessionExpiredException e) {
            connected = false;
            throw new StoreConnectionException("Lost connection to graph store: " + e.getMessage(), e);
        } catch (Neo4jException e) {
            throw new GraphQueryException(e.getMessage(), e);
        }
    }

    @Override
    public WriteSummary executeWrite(String query, Map<String, Object> params) {
        Driver d = requireDriver();
        try (Session session = d.session()) {
            return session.executeWrite(tx -> {
                Result result = tx.run(query, params);
                List<Map<String, Object>> rows = result.list(Record::asMap);
                SummaryCounters c = result.consume().counters();
                return new WriteSummary(
                        rows,
                        c.nodesCreated(),
                        c.nodesDeleted(),
                        c.relationshipsCreated(),
                        c.relationshipsDeleted(),
                        c.propertiesSet()
                );
            });
        } catch (ServiceUnavailableException | SessionExpiredException e) {
            connected = false;
            throw new StoreConnectionException("Lost connection to graph store: " + e.getMessage(), e);
        } catch (Neo4jException e) {
            throw new GraphQueryException(e.getMessage(), e);
        }
    }

    @Override
    public synchronized void close() {
        Driver d = driver;
        driver = null;
        connected = false;
        if (d != null) {
            d.close();
        }
    }

    private Driver requireDriver() {
        Driver d = driver;
        if (!connected || d == null) {
            throw new StoreConnectionException("Not connected to graph store at " + uri);
        }
        return d;
    }
}
