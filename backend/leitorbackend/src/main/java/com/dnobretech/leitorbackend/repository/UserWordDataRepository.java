package com.dnobretech.leitorbackend.repository;

import com.dnobretech.leitorbackend.domain.UserWordData;
import com.dnobretech.leitorbackend.domain.UserWordDataId;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UserWordDataRepository extends JpaRepository<UserWordData, UserWordDataId> {
}
