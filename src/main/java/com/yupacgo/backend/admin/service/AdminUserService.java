package com.yupacgo.backend.admin.service;

import com.yupacgo.backend.admin.dto.UserPage;
import com.yupacgo.backend.auth.dto.UserView;
import com.yupacgo.backend.auth.entity.Role;
import com.yupacgo.backend.auth.entity.User;
import com.yupacgo.backend.auth.repo.UserRepo;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class AdminUserService {

    static final int MAX_LIMIT = 100;

    private final UserRepo users;

    public AdminUserService(UserRepo users) {
        this.users = users;
    }

    /** Regular users only, newest first. */
    public UserPage list(int page, int limit) {
        int p = Math.max(1, page);
        int size = limit <= 0 ? 20 : Math.min(limit, MAX_LIMIT);

        Page<User> result = users.findByRole(Role.USER, PageRequest.of(p - 1, size, Sort.by(Sort.Direction.DESC, "createdAt", "id")));
        return new UserPage(
                result.map(UserView::of).getContent(),
                p,
                size,
                result.getTotalElements(),
                result.getTotalPages()
        );
    }
}
