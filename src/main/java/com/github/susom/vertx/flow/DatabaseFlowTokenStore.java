/*
 * Copyright 2026 The Board of Trustees of The Leland Stanford Junior University.
 * All Rights Reserved.
 *
 * See the NOTICE and LICENSE files distributed with this work for information
 * regarding copyright ownership and licensing. You may not use this file except
 * in compliance with a written license agreement with Stanford University.
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See your
 * License for the specific language governing permissions and limitations under
 * the License.
 */
package com.github.susom.vertx.flow;

import com.github.susom.database.Database;
import com.github.susom.database.DatabaseException;
import com.github.susom.database.DatabaseProvider.Builder;
import com.github.susom.database.Metric;
import com.github.susom.database.Row;
import com.github.susom.database.Schema;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.function.Supplier;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Token store backed by the flow_token table. Use {@link #createSchema(Builder)}
 * to create the table.
 *
 * <p>Each operation runs in its own transaction obtained from the builder.
 * Atomicity comes from the unique constraints on identifier and key plus
 * conditional updates that compare against the values previously read, so it
 * also holds across server processes sharing the database.</p>
 */
public class DatabaseFlowTokenStore implements FlowTokenStore {
  private static final Logger log = LoggerFactory.getLogger(DatabaseFlowTokenStore.class);
  private static final String COLUMNS = "token_identifier, token_key, flow_slug, owner_id, expires_at, plan_snapshot";
  private final Builder db;
  private final TokenGenerator keys;
  private final Clock clock;

  public DatabaseFlowTokenStore(Builder db, TokenGenerator keys, Clock clock) {
    this.db = db;
    this.keys = keys;
    this.clock = clock;
  }

  public static void createSchema(Builder db) {
    db.transact(dbs -> new Schema()
        .addTable("flow_token")
          .addColumn("token_identifier").asString(200).notNull().table()
          .addColumn("token_key").asString(80).notNull().table()
          .addColumn("flow_slug").asString(100).notNull().table()
          .addColumn("owner_id").asString(200).notNull().table()
          .addColumn("expires_at").asDate().notNull().table()
          .addColumn("plan_snapshot").asClob().notNull().table()
          .addColumn("consumed_at").asDate().table()
          .addIndex("flow_token_ident_uk", "token_identifier").unique().table()
          .addIndex("flow_token_key_uk", "token_key").unique().table()
          .schema()
        .execute(dbs));
  }

  @Nonnull
  @Override
  public FlowToken getOrCreate(@Nonnull String identifier, @Nonnull String owner, @Nonnull FlowPlan plan,
                               @Nonnull Duration ttl) {
    FlowToken existing = findByIdentifier(identifier);
    if (existing != null) {
      return existing;
    }

    Metric metric = new Metric(log.isDebugEnabled());
    FlowToken token = new FlowToken(identifier, keys.create(), plan.flowSlug(), owner, clock.instant().plus(ttl),
        FlowPlanCodec.encode(plan));
    try {
      db.transact(dbs -> dbs.get().toInsert("insert into flow_token (" + COLUMNS + ") values (?,?,?,?,?,?)")
          .argString(token.identifier())
          .argString(token.key())
          .argString(token.flowSlug())
          .argString(token.owner())
          .argDate(Date.from(token.expires()))
          .argClobString(token.planSnapshot())
          .insert(1));
    } catch (DatabaseException e) {
      // Most likely someone else inserted the same identifier between our select and insert.
      // The failed transaction was rolled back, so look in a new one.
      FlowToken winner = findByIdentifier(identifier);
      if (winner != null) {
        log.debug("Lost the race creating {}, using the existing token", identifier);
        return winner;
      }
      throw new FlowStorageException("Unable to create flow token " + identifier, e);
    }
    metric.checkpoint("insert");
    log.debug("Created {} {}", token, metric.getMessage());
    return token;
  }

  @Nullable
  @Override
  public FlowToken findByIdentifier(@Nonnull String identifier) {
    try {
      return db.transactReturning(dbs -> selectByIdentifier(dbs, identifier));
    } catch (DatabaseException e) {
      throw new FlowStorageException("Unable to read flow token " + identifier, e);
    }
  }

  @Nonnull
  @Override
  public TokenRedemption inspect(@Nonnull String key) {
    TokenRedemption redemption;
    try {
      redemption = db.transactReturning(dbs -> dbs.get().toSelect("select " + COLUMNS + ", consumed_at"
          + " from flow_token where token_key=?")
          .argString(key)
          .queryOneOrNull(r -> {
            FlowToken token = readToken(r);
            Date consumed = r.getDateOrNull();
            if (consumed != null || token.isExpired(clock.instant())) {
              return TokenRedemption.expired(token);
            }
            return TokenRedemption.valid(token);
          }));
    } catch (DatabaseException e) {
      throw new FlowStorageException("Unable to read flow token", e);
    }
    return redemption == null ? TokenRedemption.notFound() : redemption;
  }

  /**
   * Consumption is recorded in consumed_at as well as the expiry, so a server
   * whose clock runs behind the one that consumed the token still sees it as
   * used.
   */
  @Override
  public boolean consume(@Nonnull FlowToken token) {
    Instant now = clock.instant();
    if (token.isExpired(now)) {
      return false;
    }

    int updated;
    try {
      // Compare-and-set on what we read, so only one caller can consume it
      updated = db.transactReturning(dbs -> dbs.get().toUpdate("update flow_token set expires_at=?, consumed_at=?"
          + " where token_key=? and expires_at=? and consumed_at is null")
          .argDate(Date.from(now))
          .argDate(Date.from(now))
          .argString(token.key())
          .argDate(Date.from(token.expires()))
          .update());
    } catch (DatabaseException e) {
      throw new FlowStorageException("Unable to consume flow token " + token.identifier(), e);
    }
    if (updated != 1) {
      log.debug("Unable to consume {}, it changed since it was read", token);
      return false;
    }
    return true;
  }

  @Nonnull
  @Override
  public FlowToken rotate(@Nonnull FlowToken token, @Nonnull Duration ttl) {
    return rotate(token, ttl, null);
  }

  @Nonnull
  @Override
  public FlowToken rotate(@Nonnull FlowToken token, @Nonnull Duration ttl, FlowPlan plan) {
    FlowToken current = findByIdentifier(token.identifier());
    if (current == null) {
      throw new IllegalStateException("No token stored for identifier " + token.identifier());
    }
    if (!current.key().equals(token.key())) {
      log.debug("Token {} was already rotated, returning {}", token.identifier(), current);
      return current;
    }

    Instant expires = clock.instant().plus(ttl);
    if (!expires.isAfter(current.expires())) {
      expires = current.expires().plus(ttl);
    }
    String snapshot = plan == null ? current.planSnapshot() : FlowPlanCodec.encode(plan);
    FlowToken rotated = current.withKey(keys.create(), expires, snapshot);

    int updated;
    try {
      // Compare-and-set on the old key so a concurrent rotation cannot leave two live keys
      updated = db.transactReturning(dbs -> dbs.get().toUpdate("update flow_token set token_key=?, expires_at=?,"
          + " plan_snapshot=?, consumed_at=null where token_identifier=? and token_key=?")
          .argString(rotated.key())
          .argDate(Date.from(rotated.expires()))
          .argClobString(rotated.planSnapshot())
          .argString(rotated.identifier())
          .argString(current.key())
          .update());
    } catch (DatabaseException e) {
      throw new FlowStorageException("Unable to rotate flow token " + token.identifier(), e);
    }
    if (updated != 1) {
      FlowToken winner = findByIdentifier(token.identifier());
      if (winner == null) {
        throw new FlowStorageException("Flow token " + token.identifier() + " disappeared during rotation");
      }
      log.debug("Lost the race rotating {}, returning {}", token.identifier(), winner);
      return winner;
    }
    log.debug("Rotated {} to {}", current, rotated);
    return rotated;
  }

  private FlowToken selectByIdentifier(Supplier<Database> dbs, String identifier) {
    return dbs.get().toSelect("select " + COLUMNS + " from flow_token where token_identifier=?")
        .argString(identifier)
        .queryOneOrNull(this::readToken);
  }

  private FlowToken readToken(Row r) {
    return new FlowToken(
        r.getStringOrNull(),
        r.getStringOrNull(),
        r.getStringOrNull(),
        r.getStringOrNull(),
        r.getDateOrNull().toInstant(),
        r.getClobStringOrNull());
  }
}
