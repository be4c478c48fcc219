/*
 * Copyright (c) 2026 MakiBytes.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package de.makibytes.neonwatch.store;

import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import de.makibytes.neonwatch.model.TransactionOutcome;

/**
 * Checkpoint store on Redis sets. SADD makes re-persisting a signature a no-op.
 */
@Component
public class RedisCheckpointStore implements CheckpointStore {

    private static final Logger logger = LoggerFactory.getLogger(RedisCheckpointStore.class);

    private final StringRedisTemplate redisTemplate;

    public RedisCheckpointStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Checkpoint restore(CheckpointKey key) throws StoreUnavailableException {
        Set<String> processed = loadAllGroupMembers(key, SignatureGroup.PROCESSED);
        Set<String> failed = loadAllGroupMembers(key, SignatureGroup.FAILED);
        String last;
        try {
            last = redisTemplate.opsForValue().get(CheckpointKeys.cursor(key));
        } catch (DataAccessException ex) {
            throw unavailable("read cursor of " + key, ex);
        }
        Checkpoint checkpoint = new Checkpoint(processed, failed, last);
        logger.debug("Restored checkpoint {}: {} processed, {} failed, cursor {}",
                key, checkpoint.processed().size(), checkpoint.failed().size(), last);
        return checkpoint;
    }

    @Override
    public void persistSignature(CheckpointKey key, String signature, TransactionOutcome outcome)
            throws StoreUnavailableException {
        SignatureGroup group = SignatureGroup.of(outcome);
        try {
            redisTemplate.opsForSet().add(CheckpointKeys.group(key, group), signature);
            redisTemplate.opsForValue().set(CheckpointKeys.cursor(key), signature);
        } catch (DataAccessException ex) {
            throw unavailable("persist " + signature + " for " + key, ex);
        }
    }

    @Override
    public void advanceCursor(CheckpointKey key, String signature) throws StoreUnavailableException {
        try {
            redisTemplate.opsForValue().set(CheckpointKeys.cursor(key), signature);
        } catch (DataAccessException ex) {
            throw unavailable("advance cursor of " + key, ex);
        }
    }

    @Override
    public Set<String> loadAllGroupMembers(CheckpointKey key, SignatureGroup group) throws StoreUnavailableException {
        try {
            Set<String> members = redisTemplate.opsForSet().members(CheckpointKeys.group(key, group));
            return members == null ? Set.of() : members;
        } catch (DataAccessException ex) {
            throw unavailable("read " + group.getKeySuffix() + " set of " + key, ex);
        }
    }

    private static StoreUnavailableException unavailable(String action, DataAccessException cause) {
        return new StoreUnavailableException("Redis unavailable, could not " + action, cause);
    }
}
